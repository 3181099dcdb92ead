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

import static com.linecorp.mime.MimeChars.isQuoted;
import static com.linecorp.mime.MimeChars.isToken;

import com.google.common.base.Ascii;

import com.linecorp.mime.annotation.Nullable;

/**
 * A single-pass scanner of the media type grammar of RFC 7231 which records offsets instead of copying.
 *
 * <pre>{@code
 * media-type = type "/" subtype *( OWS ";" OWS parameter )
 * parameter  = token "=" ( token / quoted-string )
 * }</pre>
 */
final class MimeScanner {

    private static final String ANY_TYPE = "*/*";

    private final boolean internKnownTypes;
    private final boolean rejectMultipleSuffixMarkers;
    private final int maxLength;

    MimeScanner(boolean internKnownTypes, boolean rejectMultipleSuffixMarkers, int maxLength) {
        this.internKnownTypes = internKnownTypes;
        this.rejectMultipleSuffixMarkers = rejectMultipleSuffixMarkers;
        this.maxLength = maxLength;
    }

    Mime scan(String input, boolean allowRange) {
        final int length = input.length();
        if (length > maxLength) {
            throw MimeParseException.tooLong(input);
        }

        if (ANY_TYPE.equals(input)) {
            if (!allowRange) {
                throw MimeParseException.invalidRange(input);
            }
            return internKnownTypes ? Mime.ANY_TYPE : new Mime(ANY_TYPE, 0, 1, -1, ParamSource.NONE);
        }

        // type
        int slash = -1;
        for (int i = 0; i < length; i++) {
            final char c = input.charAt(i);
            if (c == '/' && i > 0) {
                slash = i;
                break;
            }
            if (!isToken(c)) {
                throw MimeParseException.invalidToken(input, i);
            }
        }
        if (slash < 0) {
            throw MimeParseException.missingSlash(input);
        }

        // subtype
        final int subtypeStart = slash + 1;
        if (subtypeStart == length) {
            // An empty subtype.
            throw MimeParseException.invalidToken(input, subtypeStart);
        }
        int plus = -1;
        int paramsStart = -1;
        for (int i = subtypeStart; i < length; i++) {
            final char c = input.charAt(i);
            if (i == subtypeStart) {
                if (c == '*') {
                    if (!allowRange) {
                        throw MimeParseException.invalidRange(input);
                    }
                    final int next = i + 1;
                    if (next < length) {
                        final char n = input.charAt(next);
                        if (n != ';' && n != ' ') {
                            throw MimeParseException.invalidToken(input, next);
                        }
                        paramsStart = next;
                    }
                    break;
                }
            } else {
                if (c == '+') {
                    if (plus < 0) {
                        plus = i;
                    } else if (rejectMultipleSuffixMarkers) {
                        throw MimeParseException.invalidToken(input, i);
                    }
                    continue;
                }
                if (c == ';' || c == ' ') {
                    paramsStart = i;
                    break;
                }
            }
            if (!isToken(c)) {
                throw MimeParseException.invalidToken(input, i);
            }
        }

        if (paramsStart < 0) {
            return finish(input, slash, plus, ParamSource.NONE, length);
        }

        final ParamSource params = scanParams(input, paramsStart);
        return finish(input, slash, plus, params, paramsStart);
    }

    private static ParamSource scanParams(String input, int paramsStart) {
        final int length = input.length();
        ParamSource params = ParamSource.NONE;
        int start = paramsStart + 1;
        params:
        while (start < length) {
            // name
            final int nameStart = start;
            int i = start;
            for (;;) {
                if (i == length) {
                    throw MimeParseException.missingEqual(input);
                }
                final char c = input.charAt(i);
                if (i == nameStart && (c == ' ' || c == ';')) {
                    start = i + 1;
                    continue params;
                }
                if (c == '=' && i > nameStart) {
                    break;
                }
                if (!isToken(c)) {
                    throw MimeParseException.invalidToken(input, i);
                }
                i++;
            }
            final int nameEnd = i;

            // value
            final int valueStart = nameEnd + 1;
            final int valueEnd;
            if (valueStart < length && input.charAt(valueStart) == '"') {
                i = valueStart + 1;
                for (;;) {
                    if (i == length) {
                        throw MimeParseException.missingQuote(input);
                    }
                    final char c = input.charAt(i);
                    if (c == '"') {
                        break;
                    }
                    if (c == '\\') {
                        i++;
                        if (i == length) {
                            throw MimeParseException.missingQuote(input);
                        }
                        if (!isQuoted(input.charAt(i))) {
                            throw MimeParseException.invalidToken(input, i);
                        }
                    } else if (!isQuoted(c)) {
                        throw MimeParseException.invalidToken(input, i);
                    }
                    i++;
                }
                valueEnd = i + 1;

                // Only spaces may follow a quoted-string until the next ';'.
                for (i = valueEnd; i < length; i++) {
                    final char c = input.charAt(i);
                    if (c == ';') {
                        break;
                    }
                    if (c != ' ') {
                        throw MimeParseException.invalidToken(input, i);
                    }
                }
            } else {
                for (i = valueStart; i < length; i++) {
                    final char c = input.charAt(i);
                    if ((c == ';' || c == ' ') && i > valueStart) {
                        break;
                    }
                    if (!isToken(c)) {
                        throw MimeParseException.invalidToken(input, i);
                    }
                }
                if (i == valueStart) {
                    // An empty value at the end of the input.
                    throw MimeParseException.invalidToken(input, i);
                }
                valueEnd = i;
            }

            params = params.append(input, paramsStart,
                                   ParamSource.pair(nameStart, nameEnd, valueStart, valueEnd));
            start = i + 1;
        }
        return params;
    }

    /**
     * Resolves the scanned offsets into an interned constant or a normalized dynamic copy.
     */
    private Mime finish(String input, int slash, int plus, ParamSource params, int essenceEnd) {
        switch (params.kind()) {
            case NONE: {
                if (internKnownTypes) {
                    final Mime known = Atoms.intern(input, slash, essenceEnd);
                    if (known != null) {
                        return known;
                    }
                }
                final String essence = essenceEnd == input.length() ? input : input.substring(0, essenceEnd);
                return new Mime(Ascii.toLowerCase(essence), 0, slash, plus, ParamSource.NONE);
            }
            case UTF8: {
                if (internKnownTypes) {
                    final Mime known = Atoms.internUtf8(input, slash, essenceEnd);
                    if (known != null) {
                        return known;
                    }
                }
                return new Mime(Ascii.toLowerCase(input), 0, slash, plus, params);
            }
            default:
                return new Mime(toLowerCase(input, params), 0, slash, plus, params);
        }
    }

    /**
     * Lower-cases the essence, the parameter names and the values of {@code charset} parameters.
     * Other parameter values are kept as they are.
     */
    private static String toLowerCase(String input, ParamSource params) {
        final char[] chars = input.toCharArray();
        MimeChars.toLowerCase(chars, 0, params.start());
        for (int i = 0; i < params.size(); i++) {
            final long pair = params.pair(i);
            final int nameStart = ParamSource.nameStart(pair);
            final int nameEnd = ParamSource.nameEnd(pair);
            MimeChars.toLowerCase(chars, nameStart, nameEnd);
            if (MimeChars.regionEqualsLower(input, nameStart, nameEnd, "charset")) {
                MimeChars.toLowerCase(chars, ParamSource.valueStart(pair), ParamSource.valueEnd(pair));
            }
        }
        return new String(chars);
    }

    @Nullable
    Mime tryScan(String input, boolean allowRange) {
        try {
            return scan(input, allowRange);
        } catch (MimeParseException unused) {
            return null;
        }
    }
}
