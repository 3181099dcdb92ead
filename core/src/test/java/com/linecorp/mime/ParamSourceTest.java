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

import static com.linecorp.mime.ParamSource.Kind.CUSTOM;
import static com.linecorp.mime.ParamSource.Kind.NONE;
import static com.linecorp.mime.ParamSource.Kind.ONE;
import static com.linecorp.mime.ParamSource.Kind.TWO;
import static com.linecorp.mime.ParamSource.Kind.UTF8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ParamSourceTest {

    private static final MimeParser nonInterningParser = MimeParser.builder()
                                                                   .internKnownTypes(false)
                                                                   .build();

    @ParameterizedTest
    @CsvSource({
            "text/plain,                                  NONE,   -1, 0",
            "'text/plain;',                               NONE,   -1, 0",
            "'text/plain; charset=utf-8',                 UTF8,   10, 1",
            "'text/plain; CHARSET=UTF-8',                 UTF8,   10, 1",
            "'text/plain;;charset=utf-8',                 UTF8,   10, 1",
            "'text/plain;charset=utf-8',                  ONE,    10, 1",
            "'text/plain; charset=\"utf-8\"',             ONE,    10, 1",
            "'text/plain; charset=utf-16',                ONE,    10, 1",
            "'text/plain; format=flowed',                 ONE,    10, 1",
            "'text/plain; charset=utf-8; format=flowed',  TWO,    10, 2",
            "'text/plain; a=1; b=2',                      TWO,    10, 2",
            "'text/plain; a=1; b=2; c=3',                 CUSTOM, 10, 3",
            "'text/plain ; a=1; b=2; c=3; d=4; e=5; f=6', CUSTOM, 10, 6",
    })
    void shapes(String input, ParamSource.Kind kind, int start, int size) {
        final ParamSource params = nonInterningParser.parse(input).paramSource();
        assertThat(params.kind()).isEqualTo(kind);
        assertThat(params.start()).isEqualTo(start);
        assertThat(params.size()).isEqualTo(size);
    }

    @Test
    void pairPacking() {
        final long pair = ParamSource.pair(1, 65535, 32768, 0);
        assertThat(ParamSource.nameStart(pair)).isEqualTo(1);
        assertThat(ParamSource.nameEnd(pair)).isEqualTo(65535);
        assertThat(ParamSource.valueStart(pair)).isEqualTo(32768);
        assertThat(ParamSource.valueEnd(pair)).isZero();
    }

    @Test
    void utf8IsMaterializedWhenPromoted() {
        final Mime mime = nonInterningParser.parse("text/plain; charset=utf-8; a=b");
        final ParamSource params = mime.paramSource();
        final long charset = params.pair(0);
        assertThat(mime.toString().substring(ParamSource.nameStart(charset), ParamSource.nameEnd(charset)))
                .isEqualTo("charset");
        assertThat(mime.toString().substring(ParamSource.valueStart(charset),
                                             ParamSource.valueEnd(charset)))
                .isEqualTo("utf-8");
    }

    @Test
    void utf8PairIsImplicit() {
        final ParamSource params = Mime.PLAIN_TEXT_UTF_8.paramSource();
        assertThat(params.source("ignored")).isEqualTo(ParamSource.UTF_8_PAIR_SOURCE);
        assertThat(params.pair(0)).isEqualTo(ParamSource.UTF_8_PAIR);
        assertThatThrownBy(() -> params.pair(1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> ParamSource.NONE.pair(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void quotedValueRangeIncludesQuotes() {
        final Mime mime = Mime.parse("text/plain; a=\"b c\"");
        final long pair = mime.paramSource().pair(0);
        assertThat(mime.toString().substring(ParamSource.valueStart(pair), ParamSource.valueEnd(pair)))
                .isEqualTo("\"b c\"");
    }
}
