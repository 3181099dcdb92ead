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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Microbenchmarks for comparing media types.
 */
public class CompareBenchmark {

    private static final MimeParser NON_INTERNING_PARSER = MimeParser.builder()
                                                                     .internKnownTypes(false)
                                                                     .build();

    private static final Mime DYNAMIC_PLAIN_TEXT_UTF_8 =
            NON_INTERNING_PARSER.parse("text/plain; charset=utf-8");

    private static final Mime QUOTED_PLAIN_TEXT_UTF_8 = Mime.parse("text/plain; charset=\"UTF-8\"");

    private static final Mime PARAMS_1 = Mime.parse("text/plain; a=1; b=2; c=3");

    private static final Mime PARAMS_2 = Mime.parse("text/plain; c=3; b=2; a=1");

    @Benchmark
    public void atomToAtom(Blackhole bh) {
        bh.consume(Mime.PLAIN_TEXT_UTF_8.equals(Mime.JSON_UTF_8));
    }

    @Benchmark
    public void atomToDynamic(Blackhole bh) {
        bh.consume(Mime.PLAIN_TEXT_UTF_8.equals(DYNAMIC_PLAIN_TEXT_UTF_8));
    }

    @Benchmark
    public void atomToQuoted(Blackhole bh) {
        bh.consume(Mime.PLAIN_TEXT_UTF_8.equals(QUOTED_PLAIN_TEXT_UTF_8));
    }

    @Benchmark
    public void dynamicToDynamic(Blackhole bh) {
        bh.consume(PARAMS_1.equals(PARAMS_2));
    }

    @Benchmark
    public void equalsString(Blackhole bh) {
        bh.consume(Mime.PLAIN_TEXT_UTF_8.equalsString("text/plain; charset=utf-8"));
        bh.consume(Mime.PLAIN_TEXT.equalsString("TEXT/PLAIN"));
    }

    @Benchmark
    public void rangeMatch(Blackhole bh) {
        bh.consume(Mime.ANY_TEXT_TYPE.matches(DYNAMIC_PLAIN_TEXT_UTF_8));
    }
}
