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

import java.util.Arrays;

/**
 * The parameters of a {@link Mime}, stored as offsets into its backing string.
 *
 * <p>A parameter is a pair of half-open ranges packed into a {@code long}: name start, name end,
 * value start and value end, 16 bits each. The value range includes the surrounding quotes of a
 * quoted-string. The shape grows as parameters are parsed:
 * {@code NONE -> UTF8 | ONE}, {@code UTF8 -> TWO}, {@code ONE -> TWO}, {@code TWO -> CUSTOM}.
 */
abstract class ParamSource {

    /**
     * The backing string of the implicit pair of {@link Kind#UTF8}.
     */
    static final String UTF_8_PAIR_SOURCE = "charset=utf-8";
    static final long UTF_8_PAIR = pair(0, 7, 8, 13);

    static final ParamSource NONE = new None();

    enum Kind {
        NONE, UTF8, ONE, TWO, CUSTOM
    }

    static long pair(int nameStart, int nameEnd, int valueStart, int valueEnd) {
        return (long) nameStart << 48 | (long) nameEnd << 32 | (long) valueStart << 16 | valueEnd;
    }

    static int nameStart(long pair) {
        return (int) (pair >>> 48) & 0xFFFF;
    }

    static int nameEnd(long pair) {
        return (int) (pair >>> 32) & 0xFFFF;
    }

    static int valueStart(long pair) {
        return (int) (pair >>> 16) & 0xFFFF;
    }

    static int valueEnd(long pair) {
        return (int) pair & 0xFFFF;
    }

    abstract Kind kind();

    /**
     * Returns the index of the {@code ';'} or the space that ends the essence, or {@code -1} if there are
     * no parameters.
     */
    abstract int start();

    abstract int size();

    /**
     * Returns the {@code index}-th pair. The offsets refer to {@link #source(String)}.
     */
    abstract long pair(int index);

    /**
     * Returns the string the offsets of {@link #pair(int)} refer to.
     */
    String source(String mimeSource) {
        return mimeSource;
    }

    /**
     * Returns the parameters with {@code pair} appended. {@code input} is the string being parsed and
     * {@code start} is the index of the character that introduced the parameter list.
     */
    abstract ParamSource append(String input, int start, long pair);

    private static final class None extends ParamSource {

        @Override
        Kind kind() {
            return Kind.NONE;
        }

        @Override
        int start() {
            return -1;
        }

        @Override
        int size() {
            return 0;
        }

        @Override
        long pair(int index) {
            throw new IndexOutOfBoundsException("index: " + index + " (expected: none)");
        }

        @Override
        ParamSource append(String input, int start, long pair) {
            if (nameStart(pair) == start + 2 &&
                MimeChars.regionEqualsLower(input, nameStart(pair), nameEnd(pair), "charset") &&
                MimeChars.regionEqualsLower(input, valueStart(pair), valueEnd(pair), "utf-8")) {
                return new Utf8(start);
            }
            return new One(start, pair);
        }
    }

    /**
     * A single {@code charset=utf-8} parameter written as {@code "; charset=utf-8"}. The pair is implicit
     * and never read from the backing string.
     */
    static final class Utf8 extends ParamSource {

        private final int start;

        Utf8(int start) {
            this.start = start;
        }

        @Override
        Kind kind() {
            return Kind.UTF8;
        }

        @Override
        int start() {
            return start;
        }

        @Override
        int size() {
            return 1;
        }

        @Override
        long pair(int index) {
            if (index != 0) {
                throw new IndexOutOfBoundsException("index: " + index + " (expected: 0)");
            }
            return UTF_8_PAIR;
        }

        @Override
        String source(String mimeSource) {
            return UTF_8_PAIR_SOURCE;
        }

        @Override
        ParamSource append(String input, int start, long pair) {
            final int nameStart = this.start + 2;
            final long utf8 = pair(nameStart, nameStart + 7, nameStart + 8, nameStart + 13);
            return new Two(this.start, utf8, pair);
        }
    }

    private static final class One extends ParamSource {

        private final int start;
        private final long pair;

        One(int start, long pair) {
            this.start = start;
            this.pair = pair;
        }

        @Override
        Kind kind() {
            return Kind.ONE;
        }

        @Override
        int start() {
            return start;
        }

        @Override
        int size() {
            return 1;
        }

        @Override
        long pair(int index) {
            if (index != 0) {
                throw new IndexOutOfBoundsException("index: " + index + " (expected: 0)");
            }
            return pair;
        }

        @Override
        ParamSource append(String input, int start, long pair) {
            return new Two(this.start, this.pair, pair);
        }
    }

    private static final class Two extends ParamSource {

        private final int start;
        private final long first;
        private final long second;

        Two(int start, long first, long second) {
            this.start = start;
            this.first = first;
            this.second = second;
        }

        @Override
        Kind kind() {
            return Kind.TWO;
        }

        @Override
        int start() {
            return start;
        }

        @Override
        int size() {
            return 2;
        }

        @Override
        long pair(int index) {
            switch (index) {
                case 0:
                    return first;
                case 1:
                    return second;
                default:
                    throw new IndexOutOfBoundsException("index: " + index + " (expected: 0 or 1)");
            }
        }

        @Override
        ParamSource append(String input, int start, long pair) {
            final long[] pairs = new long[4];
            pairs[0] = first;
            pairs[1] = second;
            pairs[2] = pair;
            return new Custom(this.start, pairs, 3);
        }
    }

    /**
     * Three or more parameters. The array is only grown by the scanner, before the {@link Mime} that owns
     * this source is published.
     */
    private static final class Custom extends ParamSource {

        private final int start;
        private long[] pairs;
        private int size;

        Custom(int start, long[] pairs, int size) {
            this.start = start;
            this.pairs = pairs;
            this.size = size;
        }

        @Override
        Kind kind() {
            return Kind.CUSTOM;
        }

        @Override
        int start() {
            return start;
        }

        @Override
        int size() {
            return size;
        }

        @Override
        long pair(int index) {
            if (index < 0 || index >= size) {
                throw new IndexOutOfBoundsException("index: " + index + " (expected: 0 <= index < " +
                                                    size + ')');
            }
            return pairs[index];
        }

        @Override
        ParamSource append(String input, int start, long pair) {
            if (size == pairs.length) {
                pairs = Arrays.copyOf(pairs, size << 1);
            }
            pairs[size++] = pair;
            return this;
        }
    }
}
