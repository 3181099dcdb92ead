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
import org.junit.jupiter.params.provider.CsvSource;

import com.google.common.base.Strings;

import com.linecorp.mime.MimeParseException.Reason;

class MimeParseExceptionTest {

    @ParameterizedTest
    @CsvSource({
            "text,                          MISSING_SLASH, -1",
            "'',                            MISSING_SLASH, -1",
            "/plain,                        INVALID_TOKEN, 0",
            "'te xt/plain',                 INVALID_TOKEN, 2",
            "text/,                         INVALID_TOKEN, 5",
            "'text/pl@in',                  INVALID_TOKEN, 7",
            "'text/;a=b',                   INVALID_TOKEN, 5",
            "'text/plain; charset',         MISSING_EQUAL, -1",
            "'text/plain;charset',          MISSING_EQUAL, -1",
            "'text/plain; =b',              INVALID_TOKEN, 12",
            "'text/plain; a=',              INVALID_TOKEN, 14",
            "'text/plain; a=;',             INVALID_TOKEN, 14",
            "'text/plain; a=b=c',           INVALID_TOKEN, 15",
            "'text/plain; a=\"b',           MISSING_QUOTE, -1",
            "'text/plain; a=\"b\\',         MISSING_QUOTE, -1",
            "'text/plain; a=\"b\"c',        INVALID_TOKEN, 17",
            "'text/*',                      INVALID_RANGE, -1",
            "'*/*',                         INVALID_RANGE, -1",
            "'image/*; q=1',                INVALID_RANGE, -1",
    })
    void parseFailures(String input, Reason reason, int position) {
        assertThatThrownBy(() -> Mime.parse(input))
                .as("input: %s", input)
                .isInstanceOfSatisfying(MimeParseException.class, cause -> {
                    assertThat(cause.reason()).isEqualTo(reason);
                    assertThat(cause.position()).isEqualTo(position);
                    assertThat(cause.input()).isEqualTo(input);
                });
    }

    @ParameterizedTest
    @CsvSource({
            "'text/*x',       INVALID_TOKEN, 6",
            "'text/**',       INVALID_TOKEN, 6",
            "'*/*; q=0.5',    INVALID_TOKEN, 0",
            "'*/plain',       INVALID_TOKEN, 0",
            "'text/x*',       INVALID_TOKEN, 6",
    })
    void rangeParseFailures(String input, Reason reason, int position) {
        assertThatThrownBy(() -> Mime.parseRange(input))
                .as("input: %s", input)
                .isInstanceOfSatisfying(MimeParseException.class, cause -> {
                    assertThat(cause.reason()).isEqualTo(reason);
                    assertThat(cause.position()).isEqualTo(position);
                });
    }

    @Test
    void controlCharacterInQuotedValue() {
        assertThatThrownBy(() -> Mime.parse("text/plain; a=\"b\nc\""))
                .hasMessageContaining("'\\n' (0x0A) at position 16")
                .isInstanceOfSatisfying(MimeParseException.class, cause -> {
                    assertThat(cause.reason()).isEqualTo(Reason.INVALID_TOKEN);
                    assertThat(cause.position()).isEqualTo(16);
                    assertThat(cause.invalidChar()).isEqualTo('\n');
                });

        assertThatThrownBy(() -> Mime.parse("text/plain; a=\"b\u007Fc\""))
                .isInstanceOf(MimeParseException.class)
                .hasMessageContaining("(0x7F) at position 16");
        assertThatThrownBy(() -> Mime.parse("text/plain; a=\"b\\\rc\""))
                .isInstanceOf(MimeParseException.class)
                .hasMessageContaining("'\\r' (0x0D) at position 17");
    }

    @Test
    void endOfInput() {
        assertThatThrownBy(() -> Mime.parse("text/"))
                .hasMessageContaining("end of input at position 5")
                .isInstanceOfSatisfying(MimeParseException.class,
                                        cause -> assertThat(cause.invalidChar()).isEqualTo(-1));
    }

    @Test
    void tooLong() {
        final String input = "a/" + Strings.repeat("b", MimeParser.MAX_LENGTH - 1);
        assertThat(input).hasSize(MimeParser.MAX_LENGTH + 1);
        assertThatThrownBy(() -> Mime.parse(input))
                .hasMessageContaining("(65536 chars)")
                .isInstanceOfSatisfying(MimeParseException.class,
                                        cause -> assertThat(cause.reason()).isEqualTo(Reason.TOO_LONG));

        final String longest = "a/" + Strings.repeat("b", MimeParser.MAX_LENGTH - 2);
        assertThat(Mime.parse(longest).subtype()).hasSize(MimeParser.MAX_LENGTH - 2);
    }

    @Test
    void isIllegalArgumentException() {
        assertThatThrownBy(() -> Mime.parse("text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("\"text\"")
                .hasMessageContaining(Reason.MISSING_SLASH.description());
    }

    @Test
    void escape() {
        assertThat(MimeParseException.escape('a')).isEqualTo("'a' (0x61)");
        assertThat(MimeParseException.escape('\t')).isEqualTo("'\\t' (0x09)");
        assertThat(MimeParseException.escape('\u0001')).isEqualTo("'\\u0001' (0x01)");
    }
}
