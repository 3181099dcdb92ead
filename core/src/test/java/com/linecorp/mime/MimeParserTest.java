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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.linecorp.mime.MimeParseException.Reason;

class MimeParserTest {

    @Test
    void defaultsFollowFlags() {
        final MimeParser parser = MimeParser.ofDefault();
        assertThat(parser.internKnownTypes()).isEqualTo(Flags.internKnownTypes());
        assertThat(parser.rejectMultipleSuffixMarkers()).isEqualTo(Flags.rejectMultipleSuffixMarkers());
        assertThat(parser.maxLength()).isEqualTo(Flags.maxLength());
        assertThat(Flags.maxLength()).isEqualTo(MimeParser.MAX_LENGTH);
        assertThat(MimeParser.ofDefault()).isSameAs(parser);
    }

    @Test
    void nonInterning() {
        final MimeParser parser = MimeParser.builder().internKnownTypes(false).build();
        final Mime plainText = parser.parse("text/plain");
        assertThat(plainText).isNotSameAs(Mime.PLAIN_TEXT)
                             .isEqualTo(Mime.PLAIN_TEXT);
        assertThat(plainText.atom()).isZero();
        assertThat(parser.parse("text/plain")).isNotSameAs(plainText)
                                              .isEqualTo(plainText);

        final Mime anyType = parser.parseRange("*/*");
        assertThat(anyType).isNotSameAs(Mime.ANY_TYPE)
                           .isEqualTo(Mime.ANY_TYPE);
        assertThat(anyType.atom()).isZero();

        final Mime utf8 = parser.parse("TEXT/PLAIN; CHARSET=UTF-8");
        assertThat(utf8.toString()).isEqualTo("text/plain; charset=utf-8");
        assertThat(utf8.atom()).isZero();
        assertThat(utf8).isEqualTo(Mime.PLAIN_TEXT_UTF_8);
    }

    @Test
    void rejectMultipleSuffixMarkers() {
        final MimeParser strict = MimeParser.builder().rejectMultipleSuffixMarkers(true).build();
        assertThat(strict.parse("application/vnd.api+json").suffix()).isEqualTo("json");
        assertThatThrownBy(() -> strict.parse("application/a+b+json"))
                .isInstanceOfSatisfying(MimeParseException.class, cause -> {
                    assertThat(cause.reason()).isEqualTo(Reason.INVALID_TOKEN);
                    assertThat(cause.position()).isEqualTo(15);
                    assertThat(cause.invalidChar()).isEqualTo('+');
                });

        final MimeParser lenient = MimeParser.builder().rejectMultipleSuffixMarkers(false).build();
        assertThat(lenient.parse("application/a+b+json").suffix()).isEqualTo("b+json");
    }

    @Test
    void maxLength() {
        final MimeParser parser = MimeParser.builder().maxLength(10).build();
        assertThat(parser.parse("text/plain")).isSameAs(Mime.PLAIN_TEXT);
        assertThatThrownBy(() -> parser.parse("text/plains"))
                .isInstanceOfSatisfying(MimeParseException.class,
                                        cause -> assertThat(cause.reason()).isEqualTo(Reason.TOO_LONG));
        assertThat(parser.tryParse("text/plains", false)).isNull();
    }

    @ParameterizedTest
    @ValueSource(ints = { Integer.MIN_VALUE, -1, 0, MimeParser.MAX_LENGTH + 1 })
    void invalidMaxLength(int maxLength) {
        assertThatThrownBy(() -> MimeParser.builder().maxLength(maxLength))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxLength");
    }

    @Test
    void rangeMode() {
        final MimeParser parser = MimeParser.ofDefault();
        assertThat(parser.parseRange("video/*")).isSameAs(Mime.ANY_VIDEO_TYPE);
        assertThat(parser.parse("audio/*", true)).isSameAs(Mime.ANY_AUDIO_TYPE);
        assertThat(parser.tryParse("audio/*", false)).isNull();
        assertThatThrownBy(() -> parser.parse("audio/*"))
                .isInstanceOfSatisfying(MimeParseException.class,
                                        cause -> assertThat(cause.reason()).isEqualTo(Reason.INVALID_RANGE));
    }

    @Test
    void testToString() {
        final MimeParser parser = MimeParser.builder()
                                            .internKnownTypes(false)
                                            .rejectMultipleSuffixMarkers(true)
                                            .maxLength(1024)
                                            .build();
        assertThat(parser.toString())
                .isEqualTo("MimeParser{internKnownTypes=false, rejectMultipleSuffixMarkers=true, " +
                           "maxLength=1024}");
    }
}
