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

/**
 * An {@link IllegalArgumentException} raised when a string is not a valid media type.
 */
public final class MimeParseException extends IllegalArgumentException {

    private static final long serialVersionUID = -6472941523417720164L;

    private static final int MAX_INPUT_LENGTH_IN_MESSAGE = 256;

    /**
     * The reason why a media type string was rejected.
     */
    public enum Reason {
        /**
         * The type was not followed by a {@code '/'}.
         */
        MISSING_SLASH("a slash (/) was missing between the type and subtype"),
        /**
         * A parameter name was not followed by a {@code '='}.
         */
        MISSING_EQUAL("an equals sign (=) was missing between a parameter and its value"),
        /**
         * A quoted-string was not terminated.
         */
        MISSING_QUOTE("a quote (\") was missing from a parameter value"),
        /**
         * A character is not allowed at its position.
         */
        INVALID_TOKEN("an invalid token"),
        /**
         * A wildcard was found where a media range is not allowed.
         */
        INVALID_RANGE("unexpected asterisk"),
        /**
         * The string is longer than the maximum length.
         */
        TOO_LONG("the string is too long");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        /**
         * Returns the human-readable description of this reason.
         */
        public String description() {
            return description;
        }
    }

    static MimeParseException missingSlash(String input) {
        return new MimeParseException(Reason.MISSING_SLASH, input, -1, -1);
    }

    static MimeParseException missingEqual(String input) {
        return new MimeParseException(Reason.MISSING_EQUAL, input, -1, -1);
    }

    static MimeParseException missingQuote(String input) {
        return new MimeParseException(Reason.MISSING_QUOTE, input, -1, -1);
    }

    static MimeParseException invalidToken(String input, int position) {
        final int invalidChar = position < input.length() ? input.charAt(position) : -1;
        return new MimeParseException(Reason.INVALID_TOKEN, input, position, invalidChar);
    }

    static MimeParseException invalidRange(String input) {
        return new MimeParseException(Reason.INVALID_RANGE, input, -1, -1);
    }

    static MimeParseException tooLong(String input) {
        return new MimeParseException(Reason.TOO_LONG, input, -1, -1);
    }

    private final Reason reason;
    private final String input;
    private final int position;
    private final int invalidChar;

    private MimeParseException(Reason reason, String input, int position, int invalidChar) {
        super(message(requireNonNull(reason, "reason"), input, position, invalidChar));
        this.reason = reason;
        this.input = input;
        this.position = position;
        this.invalidChar = invalidChar;
    }

    /**
     * Returns the {@link Reason} of the failure.
     */
    public Reason reason() {
        return reason;
    }

    /**
     * Returns the string that failed to parse.
     */
    public String input() {
        return input;
    }

    /**
     * Returns the index of the offending character, or {@code -1} if the failure is not tied to a position.
     */
    public int position() {
        return position;
    }

    /**
     * Returns the offending character, or {@code -1} if there is none, e.g. the input ended early.
     */
    public int invalidChar() {
        return invalidChar;
    }

    private static String message(Reason reason, String input, int position, int invalidChar) {
        final StringBuilder buf = new StringBuilder(64);
        buf.append("invalid media type: ");
        if (input.length() <= MAX_INPUT_LENGTH_IN_MESSAGE) {
            buf.append('"').append(input).append('"');
        } else {
            buf.append('(').append(input.length()).append(" chars)");
        }
        buf.append(" (").append(reason.description());
        if (position >= 0) {
            if (invalidChar >= 0) {
                buf.append(", ").append(escape((char) invalidChar));
            } else {
                buf.append(", end of input");
            }
            buf.append(" at position ").append(position);
        }
        return buf.append(')').toString();
    }

    static String escape(char c) {
        final String escaped;
        switch (c) {
            case '\t':
                escaped = "'\\t'";
                break;
            case '\r':
                escaped = "'\\r'";
                break;
            case '\n':
                escaped = "'\\n'";
                break;
            case '\'':
                escaped = "'\\''";
                break;
            case '\\':
                escaped = "'\\\\'";
                break;
            default:
                if (c >= ' ' && c < 0x7F) {
                    escaped = "'" + c + '\'';
                } else {
                    escaped = String.format("'\\u%04x'", (int) c);
                }
        }
        return String.format("%s (0x%02X)", escaped, (int) c);
    }
}
