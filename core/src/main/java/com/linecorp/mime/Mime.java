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

import static java.util.Objects.requireNonNull;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableListMultimap;

import com.linecorp.mime.annotation.Nullable;

/**
 * A media type or a media range of
 * <a href="https://datatracker.ietf.org/doc/html/rfc7231#section-3.1.1.1">RFC 7231</a>, such as
 * {@code "text/plain; charset=utf-8"} or {@code "image/*"}.
 *
 * <p>A {@link Mime} keeps the string it was parsed from and the offsets of its parts, so the accessors
 * return views of that string. The type, the subtype and the parameter names are lower-cased, as are the
 * values of {@code charset}; other parameter values are kept as they are.
 *
 * <p>The well-known media types declared in this class are interned: parsing
 * {@code "Text/Plain; Charset=UTF-8"} returns {@link #PLAIN_TEXT_UTF_8} itself, and two interned values are
 * compared by identity.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class Mime {

    private static final Logger logger = LoggerFactory.getLogger(Mime.class);

    private static final String WILDCARD = "*";
    private static final String Q = "q";

    private static final List<Mime> knownTypes = new ArrayList<>();

    /*
     * The offsets given to the constant factories are not validated here. MimeConstantsTest parses
     * every constant and compares the offsets with what the scanner finds.
     */

    public static final Mime ANY_TYPE = createConstant("*/*", 1, -1);
    public static final Mime ANY_TEXT_TYPE = createConstant("text/*", 4, -1);
    public static final Mime ANY_IMAGE_TYPE = createConstant("image/*", 5, -1);
    public static final Mime ANY_AUDIO_TYPE = createConstant("audio/*", 5, -1);
    public static final Mime ANY_VIDEO_TYPE = createConstant("video/*", 5, -1);
    public static final Mime ANY_APPLICATION_TYPE = createConstant("application/*", 11, -1);

    /* text types */

    public static final Mime PLAIN_TEXT = createConstant("text/plain", 4, -1);
    public static final Mime PLAIN_TEXT_UTF_8 = createUtf8Constant("text/plain; charset=utf-8", 4, -1, 10);
    public static final Mime HTML = createConstant("text/html", 4, -1);
    public static final Mime HTML_UTF_8 = createUtf8Constant("text/html; charset=utf-8", 4, -1, 9);
    public static final Mime CSS = createConstant("text/css", 4, -1);
    public static final Mime CSS_UTF_8 = createUtf8Constant("text/css; charset=utf-8", 4, -1, 8);
    public static final Mime TEXT_JAVASCRIPT = createConstant("text/javascript", 4, -1);
    public static final Mime XML = createConstant("text/xml", 4, -1);
    public static final Mime EVENT_STREAM = createConstant("text/event-stream", 4, -1);
    public static final Mime CSV = createConstant("text/csv", 4, -1);
    public static final Mime CSV_UTF_8 = createUtf8Constant("text/csv; charset=utf-8", 4, -1, 8);
    public static final Mime TSV = createConstant("text/tab-separated-values", 4, -1);
    public static final Mime TSV_UTF_8 =
            createUtf8Constant("text/tab-separated-values; charset=utf-8", 4, -1, 25);
    public static final Mime VCARD = createConstant("text/vcard", 4, -1);

    /* image and font types */

    public static final Mime JPEG = createConstant("image/jpeg", 5, -1);
    public static final Mime GIF = createConstant("image/gif", 5, -1);
    public static final Mime PNG = createConstant("image/png", 5, -1);
    public static final Mime BMP = createConstant("image/bmp", 5, -1);
    public static final Mime SVG = createConstant("image/svg+xml", 5, 9);
    public static final Mime FONT_WOFF = createConstant("font/woff", 4, -1);
    public static final Mime FONT_WOFF2 = createConstant("font/woff2", 4, -1);

    /* application types */

    public static final Mime JSON = createConstant("application/json", 11, -1);
    public static final Mime JSON_UTF_8 = createUtf8Constant("application/json; charset=utf-8", 11, -1, 16);
    public static final Mime JAVASCRIPT = createConstant("application/javascript", 11, -1);
    public static final Mime JAVASCRIPT_UTF_8 =
            createUtf8Constant("application/javascript; charset=utf-8", 11, -1, 22);
    public static final Mime APPLICATION_XML = createConstant("application/xml", 11, -1);
    public static final Mime FORM_DATA = createConstant("application/x-www-form-urlencoded", 11, -1);
    public static final Mime OCTET_STREAM = createConstant("application/octet-stream", 11, -1);
    public static final Mime MSGPACK = createConstant("application/msgpack", 11, -1);
    public static final Mime PDF = createConstant("application/pdf", 11, -1);
    public static final Mime DNS_MESSAGE = createConstant("application/dns-message", 11, -1);
    public static final Mime MULTIPART_FORM_DATA = createConstant("multipart/form-data", 9, -1);

    private static Mime createConstant(String source, int slash, int plus) {
        final Mime mime = new Mime(source, knownTypes.size() + 1, slash, plus, ParamSource.NONE);
        knownTypes.add(mime);
        return mime;
    }

    private static Mime createUtf8Constant(String source, int slash, int plus, int paramsStart) {
        final Mime mime = new Mime(source, knownTypes.size() + 1, slash, plus,
                                   new ParamSource.Utf8(paramsStart));
        knownTypes.add(mime);
        return mime;
    }

    /**
     * Returns the well-known media types in their declaration order.
     */
    static List<Mime> knownTypes() {
        return Collections.unmodifiableList(knownTypes);
    }

    /**
     * Parses a media type such as {@code "text/html; charset=utf-8"} using {@link MimeParser#ofDefault()}.
     * A media range such as {@code "text/*"} is rejected.
     *
     * @throws MimeParseException if {@code input} is not a valid media type
     */
    public static Mime parse(String input) {
        return MimeParser.ofDefault().parse(input);
    }

    /**
     * Parses a media range such as {@code "text/*"} or {@code "*}{@code /*"} using
     * {@link MimeParser#ofDefault()}. A media type without a wildcard is also accepted.
     *
     * @throws MimeParseException if {@code input} is not a valid media range
     */
    public static Mime parseRange(String input) {
        return MimeParser.ofDefault().parseRange(input);
    }

    /**
     * Parses a media type, or a media range if {@code allowRange} is {@code true}.
     *
     * @throws MimeParseException if {@code input} is not valid
     */
    public static Mime parse(String input, boolean allowRange) {
        return MimeParser.ofDefault().parse(input, allowRange);
    }

    /**
     * Parses a media type, returning {@code null} if {@code input} is not valid.
     */
    @Nullable
    public static Mime tryParse(String input) {
        return MimeParser.ofDefault().tryParse(input, false);
    }

    /**
     * Parses a media range, returning {@code null} if {@code input} is not valid.
     */
    @Nullable
    public static Mime tryParseRange(String input) {
        return MimeParser.ofDefault().tryParse(input, true);
    }

    private final String source;
    private final int atom;
    private final int slash;
    private final int plus;
    private final ParamSource params;

    private int hashCode;

    Mime(String source, int atom, int slash, int plus, ParamSource params) {
        this.source = source;
        this.atom = atom;
        this.slash = slash;
        this.plus = plus;
        this.params = params;
    }

    /**
     * Returns the identity of the well-known media type this value is, or {@code 0} if it is not one.
     */
    int atom() {
        return atom;
    }

    int slash() {
        return slash;
    }

    int plus() {
        return plus;
    }

    ParamSource paramSource() {
        return params;
    }

    /**
     * Returns the top-level type, e.g. {@code "text"} for {@code "text/plain"}.
     */
    public String type() {
        return source.substring(0, slash);
    }

    /**
     * Returns the subtype including the structured syntax suffix, e.g. {@code "svg+xml"} for
     * {@code "image/svg+xml"}.
     */
    public String subtype() {
        return source.substring(slash + 1, essenceEnd());
    }

    /**
     * Returns the structured syntax suffix, e.g. {@code "xml"} for {@code "image/svg+xml"}, or
     * {@code null} if the subtype has no {@code '+'}.
     */
    @Nullable
    public String suffix() {
        if (plus < 0) {
            return null;
        }
        return source.substring(plus + 1, essenceEnd());
    }

    /**
     * Returns the type and the subtype without the parameters, e.g. {@code "text/plain"} for
     * {@code "text/plain; charset=utf-8"}.
     */
    public String essence() {
        final int end = essenceEnd();
        return end == source.length() ? source : source.substring(0, end);
    }

    private int essenceEnd() {
        final int start = params.start();
        return start < 0 ? source.length() : start;
    }

    /**
     * Returns whether this value has any parameters.
     */
    public boolean hasParams() {
        return params.kind() != ParamSource.Kind.NONE;
    }

    /**
     * Returns the number of parameters, including repeated ones.
     */
    public int parameterCount() {
        return params.size();
    }

    /**
     * Returns a new iterator over the parameters in the order they appear.
     */
    public MimeParameterIterator params() {
        return new MimeParameterIterator(params.source(source), params);
    }

    /**
     * Returns the value of the first parameter whose name equals {@code name} ignoring case, with the quotes
     * of a quoted-string removed, or {@code null} if there is no such parameter.
     */
    @Nullable
    public String param(String name) {
        requireNonNull(name, "name");
        final String pairSource = params.source(source);
        final int size = params.size();
        for (int i = 0; i < size; i++) {
            final long pair = params.pair(i);
            if (ParamValues.nameEquals(pairSource, pair, name)) {
                return ParamValues.content(pairSource, ParamSource.valueStart(pair),
                                           ParamSource.valueEnd(pair));
            }
        }
        return null;
    }

    /**
     * Returns an immutable map of the parameter names to their values, with the quotes of quoted-strings
     * removed.
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public Map<String, List<String>> parameters() {
        final ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
        for (final MimeParameterIterator i = params(); i.hasNext();) {
            final MimeParameter p = i.next();
            builder.put(Ascii.toLowerCase(p.name()), p.value());
        }
        return (Map<String, List<String>>) (Map) builder.build().asMap();
    }

    /**
     * Returns the {@link Charset} named by the {@code charset} parameter, or {@code null} if there is no
     * {@code charset} parameter.
     *
     * @throws IllegalStateException if there is more than one distinct {@code charset} parameter
     * @throws java.nio.charset.IllegalCharsetNameException if the charset name is not legal
     * @throws java.nio.charset.UnsupportedCharsetException if the charset is not supported
     */
    @Nullable
    public Charset charset() {
        if (params.kind() == ParamSource.Kind.UTF8) {
            return StandardCharsets.UTF_8;
        }

        String name = null;
        for (final MimeParameterIterator i = params(); i.hasNext();) {
            final MimeParameter p = i.next();
            if (!p.isCharset()) {
                continue;
            }
            final String value = p.value();
            if (name == null) {
                name = value;
            } else if (!Ascii.equalsIgnoreCase(name, value)) {
                throw new IllegalStateException("Multiple charset values defined: " + name + ", " + value);
            }
        }
        return name != null ? Charset.forName(name) : null;
    }

    /**
     * Returns the {@link Charset} named by the {@code charset} parameter, or {@code defaultCharset} if there
     * is no {@code charset} parameter.
     */
    public Charset charset(Charset defaultCharset) {
        requireNonNull(defaultCharset, "defaultCharset");
        return MoreObjects.firstNonNull(charset(), defaultCharset);
    }

    /**
     * Returns whether the type or the subtype is the wildcard {@code '*'}.
     */
    public boolean hasWildcard() {
        return source.charAt(0) == '*' || isWildcardSubtype();
    }

    /**
     * Returns whether this value is a media range, i.e. {@link #hasWildcard()}.
     */
    public boolean isRange() {
        return hasWildcard();
    }

    private boolean isWildcardSubtype() {
        return essenceEnd() - slash == 2 && source.charAt(slash + 1) == '*';
    }

    /**
     * Returns this value without its parameters. A well-known essence is returned as its constant.
     */
    public Mime withoutParameters() {
        if (!hasParams()) {
            return this;
        }
        final int end = params.start();
        if (Flags.internKnownTypes()) {
            final Mime known = Atoms.intern(source, slash, end);
            if (known != null) {
                return known;
            }
        }
        return new Mime(source.substring(0, end), 0, slash, plus, ParamSource.NONE);
    }

    /**
     * Returns whether this media range matches the specified media type. The type and the subtype of this
     * range must be {@code '*'} or equal to those of {@code mediaType}, and every parameter of this range
     * other than {@code q} must be present in {@code mediaType} with an equal value.
     *
     * <p>For example, {@code "text/*"} matches {@code "text/plain; charset=utf-8"} but
     * {@code "text/*; charset=utf-8"} does not match {@code "text/plain"}.
     */
    public boolean matches(Mime mediaType) {
        requireNonNull(mediaType, "mediaType");
        if (source.charAt(0) != '*') {
            if (!MimeChars.regionEqualsIgnoreCase(source, 0, slash, mediaType.source, 0, mediaType.slash)) {
                return false;
            }
            if (!isWildcardSubtype() &&
                !MimeChars.regionEqualsIgnoreCase(source, slash + 1, essenceEnd(),
                                                  mediaType.source, mediaType.slash + 1,
                                                  mediaType.essenceEnd())) {
                return false;
            }
        }
        return matchesParams(mediaType);
    }

    private boolean matchesParams(Mime mediaType) {
        final String pairSource = params.source(source);
        final int size = params.size();
        for (int i = 0; i < size; i++) {
            final long pair = params.pair(i);
            if (ParamValues.nameEquals(pairSource, pair, Q)) {
                continue;
            }
            if (!mediaType.containsPair(pairSource, pair)) {
                return false;
            }
        }
        return true;
    }

    private boolean containsPair(String otherSource, long otherPair) {
        final String pairSource = params.source(source);
        final int size = params.size();
        for (int i = 0; i < size; i++) {
            if (ParamValues.pairEquals(otherSource, otherPair, pairSource, params.pair(i))) {
                return true;
            }
        }
        return false;
    }

    private boolean containsAllPairs(Mime other) {
        final String pairSource = params.source(source);
        final int size = params.size();
        for (int i = 0; i < size; i++) {
            if (!other.containsPair(pairSource, params.pair(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether this value equals the media type or media range represented by {@code value}.
     * A string that cannot be parsed is not equal to any {@link Mime}.
     */
    public boolean equalsString(String value) {
        requireNonNull(value, "value");
        if (!hasParams() && Ascii.equalsIgnoreCase(source, value)) {
            return true;
        }

        final Mime other;
        try {
            other = parseRange(value);
        } catch (MimeParseException e) {
            logger.debug("Failed to parse a media type for comparison: {}", e.getMessage());
            return false;
        }
        return equals(other);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Mime)) {
            return false;
        }

        final Mime that = (Mime) obj;
        if (atom != 0 && that.atom != 0) {
            return atom == that.atom;
        }

        if (!MimeChars.regionEqualsIgnoreCase(source, 0, essenceEnd(), that.source, 0, that.essenceEnd())) {
            return false;
        }

        final ParamSource.Kind kind = params.kind();
        final ParamSource.Kind thatKind = that.params.kind();
        if (kind == thatKind && (kind == ParamSource.Kind.NONE || kind == ParamSource.Kind.UTF8)) {
            return true;
        }
        if (kind == ParamSource.Kind.NONE || thatKind == ParamSource.Kind.NONE) {
            return false;
        }
        if (params.size() != that.params.size()) {
            return false;
        }
        return containsAllPairs(that) && that.containsAllPairs(this);
    }

    @Override
    public int hashCode() {
        int hashCode = this.hashCode;
        if (hashCode == 0) {
            hashCode = computeHashCode();
            this.hashCode = hashCode;
        }
        return hashCode;
    }

    private int computeHashCode() {
        int h = 0;
        final int essenceEnd = essenceEnd();
        for (int i = 0; i < essenceEnd; i++) {
            h = 31 * h + Ascii.toLowerCase(source.charAt(i));
        }

        // A sum of the distinct pairs, which does not depend on the order of the parameters.
        final String pairSource = params.source(source);
        final int size = params.size();
        int paramsHash = 0;
        outer:
        for (int i = 0; i < size; i++) {
            final long pair = params.pair(i);
            for (int j = 0; j < i; j++) {
                if (ParamValues.pairEquals(pairSource, params.pair(j), pairSource, pair)) {
                    continue outer;
                }
            }
            paramsHash += ParamValues.pairHashCode(pairSource, pair);
        }
        return 31 * h + paramsHash;
    }

    /**
     * Returns the string this value was parsed from, normalized as described in {@link Mime}.
     */
    @Override
    public String toString() {
        return source;
    }
}
