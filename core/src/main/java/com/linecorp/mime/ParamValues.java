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

import static com.linecorp.mime.ParamSource.nameEnd;
import static com.linecorp.mime.ParamSource.nameStart;
import static com.linecorp.mime.ParamSource.valueEnd;
import static com.linecorp.mime.ParamSource.valueStart;

import com.google.common.base.Ascii;

/**
 * Compares and hashes parameters by their content. A quoted-string and a token are equal when the
 * quoted-string without its quotes and quoted-pairs is the token, so {@code "utf-8"} in quotes equals
 * {@code utf-8}. Names are compared ignoring case; values are compared case-sensitively except the value
 * of {@code charset}.
 */
final class ParamValues {

    static final String CHARSET = "charset";

    static boolean isCharset(String source, long pair) {
        return MimeChars.regionEqualsLower(source, nameStart(pair), nameEnd(pair), CHARSET);
    }

    static boolean nameEquals(String a, long aPair, String b, long bPair) {
        return MimeChars.regionEqualsIgnoreCase(a, nameStart(aPair), nameEnd(aPair),
                                                b, nameStart(bPair), nameEnd(bPair));
    }

    static boolean nameEquals(String source, long pair, String name) {
        return MimeChars.regionEqualsIgnoreCase(source, nameStart(pair), nameEnd(pair),
                                                name, 0, name.length());
    }

    /**
     * Returns whether the two pairs have the same name and the same value content.
     */
    static boolean pairEquals(String a, long aPair, String b, long bPair) {
        if (!nameEquals(a, aPair, b, bPair)) {
            return false;
        }
        return contentEquals(a, valueStart(aPair), valueEnd(aPair),
                             b, valueStart(bPair), valueEnd(bPair), isCharset(a, aPair));
    }

    static boolean contentEquals(String a, int aStart, int aEnd,
                                 String b, int bStart, int bEnd, boolean ignoreCase) {
        final boolean aQuoted = isQuotedString(a, aStart, aEnd);
        final boolean bQuoted = isQuotedString(b, bStart, bEnd);
        if (!aQuoted && !bQuoted) {
            if (ignoreCase) {
                return MimeChars.regionEqualsIgnoreCase(a, aStart, aEnd, b, bStart, bEnd);
            }
            return aEnd - aStart == bEnd - bStart && a.regionMatches(aStart, b, bStart, aEnd - aStart);
        }

        int i = aStart;
        int aLimit = aEnd;
        if (aQuoted) {
            i++;
            aLimit--;
        }
        int j = bStart;
        int bLimit = bEnd;
        if (bQuoted) {
            j++;
            bLimit--;
        }

        for (;;) {
            final boolean aDone = i >= aLimit;
            final boolean bDone = j >= bLimit;
            if (aDone || bDone) {
                return aDone && bDone;
            }

            // A quoted-pair always has its second character before the closing quote.
            char ca = a.charAt(i++);
            if (aQuoted && ca == '\\') {
                ca = a.charAt(i++);
            }
            char cb = b.charAt(j++);
            if (bQuoted && cb == '\\') {
                cb = b.charAt(j++);
            }

            if (ca != cb && (!ignoreCase || Ascii.toLowerCase(ca) != Ascii.toLowerCase(cb))) {
                return false;
            }
        }
    }

    /**
     * Returns the content of {@code source[start, end)}: a token as it is, or a quoted-string without its
     * quotes and with its quoted-pairs unescaped.
     */
    static String content(String source, int start, int end) {
        if (!isQuotedString(source, start, end)) {
            return source.substring(start, end);
        }
        final int limit = end - 1;
        final StringBuilder buf = new StringBuilder(limit - start - 1);
        for (int i = start + 1; i < limit; i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                c = source.charAt(++i);
            }
            buf.append(c);
        }
        return buf.toString();
    }

    /**
     * Returns the hash code of a pair that is consistent with {@link #pairEquals(String, long, String, long)}.
     */
    static int pairHashCode(String source, long pair) {
        int h = 0;
        final int nameEnd = nameEnd(pair);
        for (int i = nameStart(pair); i < nameEnd; i++) {
            h = 31 * h + Ascii.toLowerCase(source.charAt(i));
        }

        final boolean ignoreCase = isCharset(source, pair);
        final int valueStart = valueStart(pair);
        final int valueEnd = valueEnd(pair);
        final boolean quoted = isQuotedString(source, valueStart, valueEnd);
        final int start = quoted ? valueStart + 1 : valueStart;
        final int limit = quoted ? valueEnd - 1 : valueEnd;
        int v = 0;
        for (int i = start; i < limit; i++) {
            char c = source.charAt(i);
            if (quoted && c == '\\') {
                c = source.charAt(++i);
            }
            v = 31 * v + (ignoreCase ? Ascii.toLowerCase(c) : c);
        }
        return 31 * h + v;
    }

    private static boolean isQuotedString(String source, int start, int end) {
        return end - start >= 2 && source.charAt(start) == '"';
    }

    private ParamValues() {}
}
