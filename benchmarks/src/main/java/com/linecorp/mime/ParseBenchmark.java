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
 * Microbenchmarks for parsing media types.
 */
public class ParseBenchmark {

    private static final MimeParser NON_INTERNING_PARSER = MimeParser.builder()
                                                                     .internKnownTypes(false)
                                                                     .build();

    @Benchmark
    public void knownType(Blackhole bh) {
        bh.consume(Mime.parse("text/plain"));
    }

    @Benchmark
    public void knownTypeWithUtf8(Blackhole bh) {
        bh.consume(Mime.parse("text/plain; charset=utf-8"));
    }

    @Benchmark
    public void knownTypeNonInterning(Blackhole bh) {
        bh.consume(NON_INTERNING_PARSER.parse("text/plain; charset=utf-8"));
    }

    @Benchmark
    public void customType(Blackhole bh) {
        bh.consume(Mime.parse("application/vnd.api+json"));
    }

    @Benchmark
    public void customTypeWithParams(Blackhole bh) {
        bh.consume(Mime.parse("multipart/form-data; boundary=\"----7MA4YWxkTrZu0gW\"; charset=utf-8"));
    }

    @Benchmark
    public void range(Blackhole bh) {
        bh.consume(Mime.parseRange("text/*; q=0.8"));
    }
}
