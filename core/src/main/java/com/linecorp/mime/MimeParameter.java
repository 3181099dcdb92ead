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

import static com.linecorp.mime.ParamSource.valueEnd;
import static com.linecorp.mime.ParamSource.valueStart;

import com.linecorp.mime.annotation.Nullable;

/**
 * A parameter of a {@link Mime}, such as {@code charset=utf-8}.
 *
 * <p>Two parameters are equal when their names are equal ignoring case and their values have the same
 * content, so {@code charset="utf-8"} equals {@code charset=UTF-8}. Only the value of {@code charset}
 * is compared ignoring case.
 */
public final class MimeParameter {

    private final String source;
    private final long pair;

    MimeParameter(String source, long pair) {
        this.source = source;
        this.pair = pair;
    }

    /**
     * Returns the name, which is in lower case.
     */
    public String name() {
        return source.substring(ParamSource.nameStart(pair), ParamSource.nameEnd(pair));
    }

    /**
     * Returns the value as written, including the quotes and the quoted-pairs of a quoted-string.
     */
    public String rawValue() {
        return source.substring(valueStart(pair), valueEnd(pair));
    }

    /**
     * Returns the value without the quotes of a quoted-string and with its quoted-pairs unescaped.
     */
    public String value() {
        return ParamValues.content(source, valueStart(pair), valueEnd(pair));
    }

    boolean isCharset() {
        return ParamValues.isCharset(source, pair);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MimeParameter)) {
            return false;
        }
        final MimeParameter that = (MimeParameter) obj;
        return ParamValues.pairEquals(source, pair, that.source, that.pair);
    }

    @Override
    public int hashCode() {
        return ParamValues.pairHashCode(source, pair);
    }

    @Override
    public String toString() {
        return name() + '=' + rawValue();
    }
}
