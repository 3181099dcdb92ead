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

/**
 * String constants defined in {@link Mime} class.
 */
public final class MimeNames {

    /**
     * {@value #ANY_TYPE}.
     */
    public static final String ANY_TYPE = "*/*";
    /**
     * {@value #ANY_TEXT_TYPE}.
     */
    public static final String ANY_TEXT_TYPE = "text/*";
    /**
     * {@value #ANY_IMAGE_TYPE}.
     */
    public static final String ANY_IMAGE_TYPE = "image/*";
    /**
     * {@value #ANY_AUDIO_TYPE}.
     */
    public static final String ANY_AUDIO_TYPE = "audio/*";
    /**
     * {@value #ANY_VIDEO_TYPE}.
     */
    public static final String ANY_VIDEO_TYPE = "video/*";
    /**
     * {@value #ANY_APPLICATION_TYPE}.
     */
    public static final String ANY_APPLICATION_TYPE = "application/*";
    /**
     * {@value #PLAIN_TEXT}.
     */
    public static final String PLAIN_TEXT = "text/plain";
    /**
     * {@value #PLAIN_TEXT_UTF_8}.
     */
    public static final String PLAIN_TEXT_UTF_8 = "text/plain; charset=utf-8";
    /**
     * {@value #HTML}.
     */
    public static final String HTML = "text/html";
    /**
     * {@value #HTML_UTF_8}.
     */
    public static final String HTML_UTF_8 = "text/html; charset=utf-8";
    /**
     * {@value #CSS}.
     */
    public static final String CSS = "text/css";
    /**
     * {@value #CSS_UTF_8}.
     */
    public static final String CSS_UTF_8 = "text/css; charset=utf-8";
    /**
     * {@value #TEXT_JAVASCRIPT}.
     */
    public static final String TEXT_JAVASCRIPT = "text/javascript";
    /**
     * {@value #XML}.
     */
    public static final String XML = "text/xml";
    /**
     * {@value #EVENT_STREAM}.
     */
    public static final String EVENT_STREAM = "text/event-stream";
    /**
     * {@value #CSV}.
     */
    public static final String CSV = "text/csv";
    /**
     * {@value #CSV_UTF_8}.
     */
    public static final String CSV_UTF_8 = "text/csv; charset=utf-8";
    /**
     * {@value #TSV}.
     */
    public static final String TSV = "text/tab-separated-values";
    /**
     * {@value #TSV_UTF_8}.
     */
    public static final String TSV_UTF_8 = "text/tab-separated-values; charset=utf-8";
    /**
     * {@value #VCARD}.
     */
    public static final String VCARD = "text/vcard";
    /**
     * {@value #JPEG}.
     */
    public static final String JPEG = "image/jpeg";
    /**
     * {@value #GIF}.
     */
    public static final String GIF = "image/gif";
    /**
     * {@value #PNG}.
     */
    public static final String PNG = "image/png";
    /**
     * {@value #BMP}.
     */
    public static final String BMP = "image/bmp";
    /**
     * {@value #SVG}.
     */
    public static final String SVG = "image/svg+xml";
    /**
     * {@value #FONT_WOFF}.
     */
    public static final String FONT_WOFF = "font/woff";
    /**
     * {@value #FONT_WOFF2}.
     */
    public static final String FONT_WOFF2 = "font/woff2";
    /**
     * {@value #JSON}.
     */
    public static final String JSON = "application/json";
    /**
     * {@value #JSON_UTF_8}.
     */
    public static final String JSON_UTF_8 = "application/json; charset=utf-8";
    /**
     * {@value #JAVASCRIPT}.
     */
    public static final String JAVASCRIPT = "application/javascript";
    /**
     * {@value #JAVASCRIPT_UTF_8}.
     */
    public static final String JAVASCRIPT_UTF_8 = "application/javascript; charset=utf-8";
    /**
     * {@value #APPLICATION_XML}.
     */
    public static final String APPLICATION_XML = "application/xml";
    /**
     * {@value #FORM_DATA}.
     */
    public static final String FORM_DATA = "application/x-www-form-urlencoded";
    /**
     * {@value #OCTET_STREAM}.
     */
    public static final String OCTET_STREAM = "application/octet-stream";
    /**
     * {@value #MSGPACK}.
     */
    public static final String MSGPACK = "application/msgpack";
    /**
     * {@value #PDF}.
     */
    public static final String PDF = "application/pdf";
    /**
     * {@value #DNS_MESSAGE}.
     */
    public static final String DNS_MESSAGE = "application/dns-message";
    /**
     * {@value #MULTIPART_FORM_DATA}.
     */
    public static final String MULTIPART_FORM_DATA = "multipart/form-data";

    private MimeNames() {}
}
