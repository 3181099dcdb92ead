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

import com.linecorp.mime.annotation.Nullable;

/**
 * Resolves a scanned media type to one of the well-known constants of {@link Mime} without making a
 * lower-cased copy of the input. The lookup branches on the length of the type, then on the length of
 * the subtype, and only then compares characters, ignoring the case of ASCII letters.
 */
final class Atoms {

    private static final String UTF_8_PARAMS = "; charset=utf-8";

    /**
     * Returns the constant whose essence equals {@code s[0, end)}, or {@code null}.
     *
     * @param slash the index of the {@code '/'}
     */
    @Nullable
    static Mime intern(String s, int slash, int end) {
        final int subtypeStart = slash + 1;
        switch (slash) {
            case 1:
                if (s.charAt(0) == '*' && is(s, subtypeStart, end, "*")) {
                    return Mime.ANY_TYPE;
                }
                return null;
            case 4:
                if (is(s, 0, 4, "text")) {
                    return text(s, subtypeStart, end);
                }
                if (is(s, 0, 4, "font")) {
                    return font(s, subtypeStart, end);
                }
                return null;
            case 5:
                if (is(s, 0, 5, "image")) {
                    return image(s, subtypeStart, end);
                }
                if (is(s, 0, 5, "video")) {
                    return is(s, subtypeStart, end, "*") ? Mime.ANY_VIDEO_TYPE : null;
                }
                if (is(s, 0, 5, "audio")) {
                    return is(s, subtypeStart, end, "*") ? Mime.ANY_AUDIO_TYPE : null;
                }
                return null;
            case 9:
                if (is(s, 0, 9, "multipart")) {
                    return is(s, subtypeStart, end, "form-data") ? Mime.MULTIPART_FORM_DATA : null;
                }
                return null;
            case 11:
                if (is(s, 0, 11, "application")) {
                    return application(s, subtypeStart, end);
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * Returns the constant which equals {@code s} when {@code s[paramsStart, s.length())} is
     * {@code "; charset=utf-8"}, or {@code null}.
     */
    @Nullable
    static Mime internUtf8(String s, int slash, int paramsStart) {
        if (!is(s, paramsStart, s.length(), UTF_8_PARAMS)) {
            return null;
        }
        final Mime essence = intern(s, slash, paramsStart);
        if (essence == null) {
            return null;
        }
        return utf8(essence);
    }

    @Nullable
    private static Mime utf8(Mime essence) {
        if (essence == Mime.PLAIN_TEXT) {
            return Mime.PLAIN_TEXT_UTF_8;
        }
        if (essence == Mime.HTML) {
            return Mime.HTML_UTF_8;
        }
        if (essence == Mime.CSS) {
            return Mime.CSS_UTF_8;
        }
        if (essence == Mime.CSV) {
            return Mime.CSV_UTF_8;
        }
        if (essence == Mime.TSV) {
            return Mime.TSV_UTF_8;
        }
        if (essence == Mime.JSON) {
            return Mime.JSON_UTF_8;
        }
        if (essence == Mime.JAVASCRIPT) {
            return Mime.JAVASCRIPT_UTF_8;
        }
        return null;
    }

    @Nullable
    private static Mime text(String s, int start, int end) {
        switch (end - start) {
            case 1:
                return is(s, start, end, "*") ? Mime.ANY_TEXT_TYPE : null;
            case 3:
                if (is(s, start, end, "css")) {
                    return Mime.CSS;
                }
                if (is(s, start, end, "csv")) {
                    return Mime.CSV;
                }
                if (is(s, start, end, "xml")) {
                    return Mime.XML;
                }
                return null;
            case 4:
                return is(s, start, end, "html") ? Mime.HTML : null;
            case 5:
                if (is(s, start, end, "plain")) {
                    return Mime.PLAIN_TEXT;
                }
                if (is(s, start, end, "vcard")) {
                    return Mime.VCARD;
                }
                return null;
            case 10:
                return is(s, start, end, "javascript") ? Mime.TEXT_JAVASCRIPT : null;
            case 12:
                return is(s, start, end, "event-stream") ? Mime.EVENT_STREAM : null;
            case 20:
                return is(s, start, end, "tab-separated-values") ? Mime.TSV : null;
            default:
                return null;
        }
    }

    @Nullable
    private static Mime font(String s, int start, int end) {
        switch (end - start) {
            case 4:
                return is(s, start, end, "woff") ? Mime.FONT_WOFF : null;
            case 5:
                return is(s, start, end, "woff2") ? Mime.FONT_WOFF2 : null;
            default:
                return null;
        }
    }

    @Nullable
    private static Mime image(String s, int start, int end) {
        switch (end - start) {
            case 1:
                return is(s, start, end, "*") ? Mime.ANY_IMAGE_TYPE : null;
            case 3:
                if (is(s, start, end, "gif")) {
                    return Mime.GIF;
                }
                if (is(s, start, end, "png")) {
                    return Mime.PNG;
                }
                if (is(s, start, end, "bmp")) {
                    return Mime.BMP;
                }
                return null;
            case 4:
                return is(s, start, end, "jpeg") ? Mime.JPEG : null;
            case 7:
                return is(s, start, end, "svg+xml") ? Mime.SVG : null;
            default:
                return null;
        }
    }

    @Nullable
    private static Mime application(String s, int start, int end) {
        switch (end - start) {
            case 1:
                return is(s, start, end, "*") ? Mime.ANY_APPLICATION_TYPE : null;
            case 3:
                if (is(s, start, end, "pdf")) {
                    return Mime.PDF;
                }
                if (is(s, start, end, "xml")) {
                    return Mime.APPLICATION_XML;
                }
                return null;
            case 4:
                return is(s, start, end, "json") ? Mime.JSON : null;
            case 7:
                return is(s, start, end, "msgpack") ? Mime.MSGPACK : null;
            case 10:
                return is(s, start, end, "javascript") ? Mime.JAVASCRIPT : null;
            case 11:
                return is(s, start, end, "dns-message") ? Mime.DNS_MESSAGE : null;
            case 12:
                return is(s, start, end, "octet-stream") ? Mime.OCTET_STREAM : null;
            case 21:
                return is(s, start, end, "x-www-form-urlencoded") ? Mime.FORM_DATA : null;
            default:
                return null;
        }
    }

    private static boolean is(String s, int start, int end, String lowerCase) {
        return MimeChars.regionEqualsLower(s, start, end, lowerCase);
    }

    private Atoms() {}
}
