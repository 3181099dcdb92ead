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

import static com.google.common.base.Preconditions.checkArgument;

import com.linecorp.mime.annotation.UnstableApi;

/**
 * Builds a new {@link MimeParser}. The defaults are the values of {@link Flags}.
 */
public final class MimeParserBuilder {

    private boolean internKnownTypes = Flags.internKnownTypes();
    private boolean rejectMultipleSuffixMarkers = Flags.rejectMultipleSuffixMarkers();
    private int maxLength = Flags.maxLength();

    MimeParserBuilder() {}

    /**
     * Sets whether the well-known media types are resolved to the constants of {@link Mime}.
     * If disabled, every parsed value is a new instance which compares structurally.
     */
    public MimeParserBuilder internKnownTypes(boolean internKnownTypes) {
        this.internKnownTypes = internKnownTypes;
        return this;
    }

    /**
     * Sets whether a subtype with more than one {@code '+'}, such as {@code "a+b+json"}, is rejected.
     */
    @UnstableApi
    public MimeParserBuilder rejectMultipleSuffixMarkers(boolean rejectMultipleSuffixMarkers) {
        this.rejectMultipleSuffixMarkers = rejectMultipleSuffixMarkers;
        return this;
    }

    /**
     * Sets the maximum length of a media type string.
     *
     * @param maxLength a value between {@code 1} and {@value MimeParser#MAX_LENGTH}
     */
    public MimeParserBuilder maxLength(int maxLength) {
        checkArgument(maxLength > 0 && maxLength <= MimeParser.MAX_LENGTH,
                      "maxLength: %s (expected: 0 < maxLength <= %s)", maxLength, MimeParser.MAX_LENGTH);
        this.maxLength = maxLength;
        return this;
    }

    /**
     * Returns a newly-created {@link MimeParser} based on the properties of this builder.
     */
    public MimeParser build() {
        return new MimeParser(internKnownTypes, rejectMultipleSuffixMarkers, maxLength);
    }
}
