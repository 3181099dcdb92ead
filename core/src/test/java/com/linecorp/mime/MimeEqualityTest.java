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

import static com.linecorp.mime.Mime.ANY_TEXT_TYPE;
import static com.linecorp.mime.Mime.PLAIN_TEXT;
import static com.linecorp.mime.Mime.PLAIN_TEXT_UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.google.common.testing.EqualsTester;

class MimeEqualityTest {

    private static final MimeParser nonInterningParser = MimeParser.builder()
                                                                   .internKnownTypes(false)
                                                                   .build();

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(
                        PLAIN_TEXT,
                        Mime.parse("TEXT/PLAIN"),
                        Mime.parse("text/plain;"),
                        nonInterningParser.parse("text/plain"),
                        nonInterningParser.parse("Text/Plain ;"),
                        PLAIN_TEXT_UTF_8.withoutParameters())
                .addEqualityGroup(
                        PLAIN_TEXT_UTF_8,
                        Mime.parse("text/plain;charset=utf-8"),
                        Mime.parse("text/plain; charset=\"utf-8\""),
                        Mime.parse("text/plain; CHARSET=\"UTF-8\""),
                        Mime.parse("text/plain ; charset=utf-8"),
                        nonInterningParser.parse("text/plain; charset=utf-8"),
                        nonInterningParser.parse("text/plain;;charset=UTF-8"))
                .addEqualityGroup(
                        Mime.parse("text/plain; charset=utf-16"),
                        Mime.parse("text/plain; charset=UTF-16"))
                .addEqualityGroup(
                        Mime.parse("text/plain; a=1; b=2"),
                        Mime.parse("text/plain; B=2; A=1"),
                        Mime.parse("text/plain;b=\"2\";a=1"))
                .addEqualityGroup(
                        Mime.parse("text/plain; a=1; b=2; c=3"),
                        Mime.parse("text/plain; c=3; a=1; b=2"),
                        Mime.parse("text/plain; c=\"3\"; b=\"2\"; a=\"1\""))
                .addEqualityGroup(Mime.parse("text/plain; a=X"))
                .addEqualityGroup(Mime.parse("text/plain; a=x"))
                .addEqualityGroup(Mime.parse("text/plain; a=1; a=1"))
                .addEqualityGroup(Mime.parse("text/plain; a=1; b=1"))
                .addEqualityGroup(Mime.parse("text/plain; charset=utf-8; format=flowed"),
                                  Mime.parse("text/plain; format=flowed; charset=UTF-8"))
                .addEqualityGroup(Mime.parse("text/plain+xml"))
                .addEqualityGroup(ANY_TEXT_TYPE, Mime.parseRange("TEXT/*"),
                                  nonInterningParser.parseRange("text/*"))
                .addEqualityGroup(Mime.ANY_TYPE, nonInterningParser.parseRange("*/*"))
                .testEquals();
    }

    @Test
    void atomFastPath() {
        final Mime a = Mime.parse("text/html");
        final Mime b = Mime.parse("TEXT/HTML");
        assertThat(a).isSameAs(b);
        assertThat(a.atom()).isNotZero();

        assertThat(Mime.JSON).isNotEqualTo(Mime.JSON_UTF_8);
        assertThat(Mime.JSON.atom()).isNotEqualTo(Mime.JSON_UTF_8.atom());
    }

    @Test
    void repeatedParametersAreNotContainment() {
        final Mime repeated = Mime.parse("text/plain; a=1; a=1");
        final Mime distinct = Mime.parse("text/plain; a=1; b=2");
        assertThat(repeated).isNotEqualTo(distinct);
        assertThat(distinct).isNotEqualTo(repeated);
    }

    @Test
    void parameterlessIsNotEqualToParameterized() {
        assertThat(PLAIN_TEXT).isNotEqualTo(PLAIN_TEXT_UTF_8);
        assertThat(nonInterningParser.parse("text/plain"))
                .isNotEqualTo(nonInterningParser.parse("text/plain; charset=utf-8"));
        assertThat(Mime.parse("text/plain; a=1")).isNotEqualTo(PLAIN_TEXT);
    }

    @Test
    void hashCodeIsCached() {
        final Mime mime = Mime.parse("application/foo; b=2; a=1");
        final int hashCode = mime.hashCode();
        assertThat(mime.hashCode()).isEqualTo(hashCode);
        assertThat(Mime.parse("application/FOO; A=1; B=\"2\"").hashCode()).isEqualTo(hashCode);
    }

    @ParameterizedTest
    @CsvSource({
            "text/plain,                TEXT/PLAIN",
            "text/plain,                'text/plain;'",
            "'text/plain; charset=utf-8', 'text/plain; charset=\"UTF-8\"'",
            "'text/plain; charset=utf-8', 'Text/Plain;Charset=Utf-8'",
            "'text/plain; a=1; b=2',    'text/plain; b=2; a=\"1\"'",
            "text/*,                    TEXT/*",
            "*/*,                       */*",
    })
    void equalsString(String mime, String value) {
        assertThat(Mime.parseRange(mime).equalsString(value)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "text/plain,                text/html",
            "text/plain,                'text/plain; charset=utf-8'",
            "'text/plain; charset=utf-8', text/plain",
            "'text/plain; a=1',         'text/plain; a=2'",
            "'text/plain; a=x',         'text/plain; a=X'",
            "text/plain,                'not a mime'",
            "'text/plain; a=1',         'text/plain; a=\"1'",
            "text/*,                    text/plain",
    })
    void notEqualsString(String mime, String value) {
        assertThat(Mime.parseRange(mime).equalsString(value)).isFalse();
    }
}
