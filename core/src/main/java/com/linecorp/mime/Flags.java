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

import java.util.function.IntPredicate;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;

/**
 * The system properties that affect the default {@link MimeParser}.
 *
 * <p>Each property is prefixed with {@code "com.linecorp.mime."}, e.g.
 * {@code -Dcom.linecorp.mime.internKnownTypes=false}.
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.mime.";

    private static final boolean DEFAULT_INTERN_KNOWN_TYPES = true;
    private static final boolean INTERN_KNOWN_TYPES =
            getBoolean("internKnownTypes", DEFAULT_INTERN_KNOWN_TYPES);

    private static final boolean DEFAULT_REJECT_MULTIPLE_SUFFIX_MARKERS = false;
    private static final boolean REJECT_MULTIPLE_SUFFIX_MARKERS =
            getBoolean("rejectMultipleSuffixMarkers", DEFAULT_REJECT_MULTIPLE_SUFFIX_MARKERS);

    private static final int DEFAULT_MAX_LENGTH = MimeParser.MAX_LENGTH;
    private static final int MAX_LENGTH =
            getInt("maxLength", DEFAULT_MAX_LENGTH, value -> value > 0 && value <= MimeParser.MAX_LENGTH);

    /**
     * Returns whether the well-known media types are resolved to the shared constants of {@link Mime}.
     * When disabled, every parsed {@link Mime} is a dynamic copy that compares structurally.
     *
     * <p>This flag is enabled by default. Specify the
     * {@code -Dcom.linecorp.mime.internKnownTypes=false} JVM option to disable it.
     */
    public static boolean internKnownTypes() {
        return INTERN_KNOWN_TYPES;
    }

    /**
     * Returns whether a subtype with more than one {@code '+'} is rejected. Only the first {@code '+'}
     * marks the structured syntax suffix, so {@code "application/a+b+json"} has the suffix
     * {@code "b+json"} unless this flag is enabled.
     *
     * <p>This flag is disabled by default. Specify the
     * {@code -Dcom.linecorp.mime.rejectMultipleSuffixMarkers=true} JVM option to enable it.
     */
    public static boolean rejectMultipleSuffixMarkers() {
        return REJECT_MULTIPLE_SUFFIX_MARKERS;
    }

    /**
     * Returns the maximum number of characters a media type string may have.
     *
     * <p>The default value of this flag is {@value MimeParser#MAX_LENGTH}. Specify the
     * {@code -Dcom.linecorp.mime.maxLength=<integer>} JVM option to override the default value.
     * Values greater than {@value MimeParser#MAX_LENGTH} are rejected.
     */
    public static int maxLength() {
        return MAX_LENGTH;
    }

    private static boolean getBoolean(String name, boolean defaultValue) {
        return Boolean.parseBoolean(getNormalized(name, String.valueOf(defaultValue),
                                                  value -> "true".equals(value) || "false".equals(value)));
    }

    private static int getInt(String name, int defaultValue, IntPredicate validator) {
        return Integer.parseInt(getNormalized(name, String.valueOf(defaultValue), value -> {
            try {
                return validator.test(Integer.parseInt(value));
            } catch (Exception e) {
                // null or non-integer
                return false;
            }
        }));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value);
        }

        if (value != null) {
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", fullName, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", fullName, value);
        }
        logger.info("{}: {} (default)", fullName, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
