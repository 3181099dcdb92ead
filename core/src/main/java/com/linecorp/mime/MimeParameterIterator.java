/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.mime;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A forward-only {@link Iterator} over the parameters of a {@link Mime}, in the order they appear.
 * The {@code charset=utf-8} of the well-known {@code UTF-8} media types is produced without reading the
 * backing string.
 */
public final class MimeParameterIterator implements Iterator<MimeParameter> {

    private final String source;
    private final ParamSource params;
    private int index;

    MimeParameterIterator(String source, ParamSource params) {
        this.source = source;
        this.params = params;
    }

    @Override
    public boolean hasNext() {
        return index < params.size();
    }

    @Override
    public MimeParameter next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return new MimeParameter(source, params.pair(index++));
    }

    /**
     * Returns the exact number of parameters this iterator has not returned yet.
     */
    public int remaining() {
        return params.size() - index;
    }
}
