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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;

/**
 * Character classes and ASCII case-insensitive region comparison used by the scanner and
 * by the equality of {@link Mime}.
 */
final class MimeChars {

    /**
     * {@code tchar} of RFC 7230. {@code '*'} is deliberately absent; it is only legal as a whole
     * subtype of a media range.
     */
    private static final CharMatcher TOKEN_MATCHER =
            CharMatcher.inRange('a', 'z')
                       .or(CharMatcher.inRange('A', 'Z'))
                       .or(CharMatcher.inRange('0', '9'))
                       .or(CharMatcher.anyOf("!#$%&'+-.^_`|~"))
                       .precomputed();

    /**
     * {@code HTAB / SP / VCHAR / obs-text}. Everything except the control characters and DEL.
     */
    private static final CharMatcher QUOTED_MATCHER =
            CharMatcher.is('\t')
                       .or(CharMatcher.inRange(' ', '~'))
                       .or(CharMatcher.inRange('\u0080', '\uffff'))
                       .precomputed();

    static boolean isToken(char c) {
        return TOKEN_MATCHER.matches(c);
    }

    static boolean isQuoted(char c) {
        return QUOTED_MATCHER.matches(c);
    }

    /**
     * Returns whether {@code s[start, end)} equals {@code lowerCase}, ignoring the case of ASCII letters.
     * {@code lowerCase} must be in lower case.
     */
    static boolean regionEqualsLower(String s, int start, int end, String lowerCase) {
        final int length = lowerCase.length();
        if (end - start != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (Ascii.toLowerCase(s.charAt(start + i)) != lowerCase.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether {@code a[aStart, aEnd)} equals {@code b[bStart, bEnd)}, ignoring the case of
     * ASCII letters.
     */
    static boolean regionEqualsIgnoreCase(String a, int aStart, int aEnd, String b, int bStart, int bEnd) {
        final int length = aEnd - aStart;
        if (bEnd - bStart != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            final char ca = a.charAt(aStart + i);
            final char cb = b.charAt(bStart + i);
            if (ca != cb && Ascii.toLowerCase(ca) != Ascii.toLowerCase(cb)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lower-cases the ASCII letters of {@code chars[start, end)} in place.
     */
    static void toLowerCase(char[] chars, int start, int end) {
        for (int i = start; i < end; i++) {
            chars[i] = Ascii.toLowerCase(chars[i]);
        }
    }

    private MimeChars() {}
}
