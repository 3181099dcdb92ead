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

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.linecorp.mime.annotation.Nullable;

/**
 * Parses media type strings into {@link Mime}s.
 *
 * <pre>{@code
 * MimeParser parser = MimeParser.builder()
 *                               .internKnownTypes(false)
 *                               .maxLength(1024)
 *                               .build();
 * Mime mime = parser.parse("application/json; charset=utf-8");
 * }</pre>
 *
 * <p>A {@link MimeParser} is immutable and thread-safe.
 */
public final class MimeParser {

    /**
     * The maximum length of a media type string. The offsets of a {@link Mime} are 16-bit wide.
     */
    public static final int MAX_LENGTH = 0xFFFF;

    private static final MimeParser DEFAULT = builder().build();

    /**
     * Returns the {@link MimeParser} configured with {@link Flags}.
     */
    public static MimeParser ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link MimeParserBuilder} whose defaults are the values of {@link Flags}.
     */
    public static MimeParserBuilder builder() {
        return new MimeParserBuilder();
    }

    private final boolean internKnownTypes;
    private final boolean rejectMultipleSuffixMarkers;
    private final int maxLength;
    private final MimeScanner scanner;

    MimeParser(boolean internKnownTypes, boolean rejectMultipleSuffixMarkers, int maxLength) {
        this.internKnownTypes = internKnownTypes;
        this.rejectMultipleSuffixMarkers = rejectMultipleSuffixMarkers;
        this.maxLength = maxLength;
        scanner = new MimeScanner(internKnownTypes, rejectMultipleSuffixMarkers, maxLength);
    }

    /**
     * Parses a media type. A wildcard is rejected with {@link MimeParseException.Reason#INVALID_RANGE}.
     *
     * @throws MimeParseException if {@code input} is not a valid media type
     */
    public Mime parse(String input) {
        return parse(input, false);
    }

    /**
     * Parses a media range such as {@code "text/*"}.
     *
     * @throws MimeParseException if {@code input} is not a valid media range
     */
    public Mime parseRange(String input) {
        return parse(input, true);
    }

    /**
     * Parses a media type, or a media range if {@code allowRange} is {@code true}.
     *
     * @throws MimeParseException if {@code input} is not valid
     */
    public Mime parse(String input, boolean allowRange) {
        requireNonNull(input, "input");
        return scanner.scan(input, allowRange);
    }

    /**
     * Parses a media type, or a media range if {@code allowRange} is {@code true}, returning {@code null}
     * if {@code input} is not valid.
     */
    @Nullable
    public Mime tryParse(String input, boolean allowRange) {
        requireNonNull(input, "input");
        return scanner.tryScan(input, allowRange);
    }

    /**
     * Returns whether the well-known media types are resolved to the constants of {@link Mime}.
     */
    public boolean internKnownTypes() {
        return internKnownTypes;
    }

    /**
     * Returns whether a subtype with more than one {@code '+'} is rejected.
     */
    public boolean rejectMultipleSuffixMarkers() {
        return rejectMultipleSuffixMarkers;
    }

    /**
     * Returns the maximum length of a media type string.
     */
    public int maxLength() {
        return maxLength;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("internKnownTypes", internKnownTypes)
                          .add("rejectMultipleSuffixMarkers", rejectMultipleSuffixMarkers)
                          .add("maxLength", maxLength)
                          .toString();
    }
}
