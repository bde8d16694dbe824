/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.xkit.http;

/** Names of the standard HTTP header fields and of the widely used non-standard ones. */
public final class HttpHeaderNames {

    private HttpHeaderNames() {}

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.3.2
    public static final String ACCEPT = "Accept";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.3.3
    public static final String ACCEPT_CHARSET = "Accept-Charset";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.3.4
    public static final String ACCEPT_ENCODING = "Accept-Encoding";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.3.5
    public static final String ACCEPT_LANGUAGE = "Accept-Language";

    // https://datatracker.ietf.org/doc/html/rfc5789#section-3.1
    public static final String ACCEPT_PATCH = "Accept-Patch";

    // https://www.w3.org/TR/ldp/#header-accept-post
    public static final String ACCEPT_POST = "Accept-Post";

    // https://datatracker.ietf.org/doc/html/rfc7233#section-2.3
    public static final String ACCEPT_RANGES = "Accept-Ranges";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Allow-Credentials
    public static final String ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Allow-Headers
    public static final String ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Allow-Methods
    public static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Allow-Origin
    public static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Expose-Headers
    public static final String ACCESS_CONTROL_EXPOSE_HEADERS = "Access-Control-Expose-Headers";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Max-Age
    public static final String ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Request-Headers
    public static final String ACCESS_CONTROL_REQUEST_HEADERS = "Access-Control-Request-Headers";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Access-Control-Request-Method
    public static final String ACCESS_CONTROL_REQUEST_METHOD = "Access-Control-Request-Method";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.1
    public static final String AGE = "Age";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.4.1
    public static final String ALLOW = "Allow";

    // https://datatracker.ietf.org/doc/html/rfc7838#section-3
    public static final String ALT_SVC = "Alt-Svc";

    // https://datatracker.ietf.org/doc/html/rfc7235#section-4.2
    public static final String AUTHORIZATION = "Authorization";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2
    public static final String CACHE_CONTROL = "Cache-Control";

    // https://www.w3.org/TR/clear-site-data/#header
    public static final String CLEAR_SITE_DATA = "Clear-Site-Data";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-6.1
    public static final String CONNECTION = "Connection";

    // https://datatracker.ietf.org/doc/html/rfc6266#section-4
    public static final String CONTENT_DISPOSITION = "Content-Disposition";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-3.1.2.2
    public static final String CONTENT_ENCODING = "Content-Encoding";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-3.1.2.2
    public static final String CONTENT_LANGUAGE = "Content-Language";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-3.3.2
    public static final String CONTENT_LENGTH = "Content-Length";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-3.1.4.2
    public static final String CONTENT_LOCATION = "Content-Location";

    // https://datatracker.ietf.org/doc/html/rfc7233#section-4.2
    public static final String CONTENT_RANGE = "Content-Range";

    // https://www.w3.org/TR/CSP3/#csp-header
    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";

    // https://www.w3.org/TR/CSP3/#cspro-header
    public static final String CONTENT_SECURITY_POLICY_REPORT_ONLY = "Content-Security-Policy-Report-Only";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-3.1.1.5
    public static final String CONTENT_TYPE = "Content-Type";

    // https://datatracker.ietf.org/doc/html/rfc6265#section-5.4
    public static final String COOKIE = "Cookie";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Cross-Origin-Embedder-Policy
    public static final String CROSS_ORIGIN_EMBEDDER_POLICY = "Cross-Origin-Embedder-Policy";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Cross-Origin-Opener-Policy
    public static final String CROSS_ORIGIN_OPENER_POLICY = "Cross-Origin-Opener-Policy";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Cross-Origin-Resource-Policy
    public static final String CROSS_ORIGIN_RESOURCE_POLICY = "Cross-Origin-Resource-Policy";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.1.1.2
    public static final String DATE = "Date";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Digest
    public static final String DIGEST = "Digest";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-2.3
    public static final String ETAG = "Etag";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.1.1
    public static final String EXPECT = "Expect";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Expect-CT
    public static final String EXPECT_CT = "Expect-CT";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.3
    public static final String EXPIRES = "Expires";

    // https://datatracker.ietf.org/doc/html/rfc7239#section-4
    public static final String FORWARDED = "Forwarded";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.5.1
    public static final String FROM = "From";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-5.4
    public static final String HOST = "Host";

    // https://datatracker.ietf.org/doc/html/rfc7540#section-3.2.1
    public static final String HTTP2_SETTINGS = "HTTP2-Settings";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-3.1
    public static final String IF_MATCH = "If-Match";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-3.3
    public static final String IF_MODIFIED_SINCE = "If-Modified-Since";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-3.2
    public static final String IF_NONE_MATCH = "If-None-Match";

    // https://datatracker.ietf.org/doc/html/rfc7233#section-3.2
    public static final String IF_RANGE = "If-Range";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-3.4
    public static final String IF_UNMODIFIED_SINCE = "If-Unmodified-Since";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Keep-Alive
    public static final String KEEP_ALIVE = "Keep-Alive";

    // https://datatracker.ietf.org/doc/html/rfc7232#section-2.2
    public static final String LAST_MODIFIED = "Last-Modified";

    // https://datatracker.ietf.org/doc/html/rfc5988#section-5
    public static final String LINK = "Link";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.1.2
    public static final String LOCATION = "Location";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.1.2
    public static final String MAX_FORWARDS = "Max-Forwards";

    // https://www.w3.org/TR/network-error-logging/#nel-response-header
    public static final String NEL = "NEL";

    // https://datatracker.ietf.org/doc/html/rfc6454#section-7
    public static final String ORIGIN = "Origin";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.4
    public static final String PRAGMA = "Pragma";

    // https://datatracker.ietf.org/doc/html/rfc7240#section-2
    public static final String PREFER = "Prefer";

    // https://datatracker.ietf.org/doc/html/rfc7235#section-4.3
    public static final String PROXY_AUTHENTICATE = "Proxy-Authenticate";

    // https://datatracker.ietf.org/doc/html/rfc7235#section-4.4
    public static final String PROXY_AUTHORIZATION = "Proxy-Authorization";

    // https://datatracker.ietf.org/doc/html/rfc7233#section-3.1
    public static final String RANGE = "Range";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.5.2
    public static final String REFERER = "Referer";

    // https://www.w3.org/TR/referrer-policy/
    public static final String REFERRER_POLICY = "Referrer-Policy";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.1.3
    public static final String RETRY_AFTER = "Retry-After";

    // https://wicg.github.io/savedata/#save-data-request-header-field
    public static final String SAVE_DATA = "Save-Data";

    // https://www.w3.org/TR/fetch-metadata/#sec-fetch-dest-header
    public static final String SEC_FETCH_DEST = "Sec-Fetch-Dest";

    // https://www.w3.org/TR/fetch-metadata/#sec-fetch-mode-header
    public static final String SEC_FETCH_MODE = "Sec-Fetch-Mode";

    // https://www.w3.org/TR/fetch-metadata/#sec-fetch-site-header
    public static final String SEC_FETCH_SITE = "Sec-Fetch-Site";

    // https://www.w3.org/TR/fetch-metadata/#sec-fetch-user-header
    public static final String SEC_FETCH_USER = "Sec-Fetch-User";

    // https://datatracker.ietf.org/doc/html/rfc6455#section-11.3.3
    public static final String SEC_WEB_SOCKET_ACCEPT = "Sec-WebSocket-Accept";

    // https://datatracker.ietf.org/doc/html/rfc6455#section-11.3.4
    public static final String SEC_WEB_SOCKET_PROTOCOL = "Sec-WebSocket-Protocol";

    // https://datatracker.ietf.org/doc/html/rfc6455#section-11.3.5
    public static final String SEC_WEB_SOCKET_VERSION = "Sec-WebSocket-Version";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.4.2
    public static final String SERVER = "Server";

    // https://www.w3.org/TR/server-timing/
    public static final String SERVER_TIMING = "Server-Timing";

    // https://datatracker.ietf.org/doc/html/rfc6265#section-5.2
    public static final String SET_COOKIE = "Set-Cookie";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/SourceMap
    public static final String SOURCE_MAP = "SourceMap";

    // https://datatracker.ietf.org/doc/html/rfc6797#section-6.1
    public static final String STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-4.3
    public static final String TE = "TE";

    // https://www.w3.org/TR/resource-timing-2/#sec-timing-allow-origin
    public static final String TIMING_ALLOW_ORIGIN = "Timing-Allow-Origin";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-4.4
    public static final String TRAILER = "Trailer";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-3.3.1
    public static final String TRANSFER_ENCODING = "Transfer-Encoding";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-6.7
    public static final String UPGRADE = "Upgrade";

    // https://www.w3.org/TR/upgrade-insecure-requests/#preference
    public static final String UPGRADE_INSECURE_REQUESTS = "Upgrade-Insecure-Requests";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-5.5.3
    public static final String USER_AGENT = "User-Agent";

    // https://datatracker.ietf.org/doc/html/rfc7231#section-7.1.4
    public static final String VARY = "Vary";

    // https://datatracker.ietf.org/doc/html/rfc7230#section-5.7.1
    public static final String VIA = "Via";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Want-Digest
    public static final String WANT_DIGEST = "Want-Digest";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.5
    public static final String WARNING = "Warning";

    // https://datatracker.ietf.org/doc/html/rfc7235#section-4.1
    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

    // https://datatracker.ietf.org/doc/draft-ietf-httpapi-idempotency-key-header/
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-Content-Type-Options
    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-DNS-Prefetch-Control
    public static final String X_DNS_PREFETCH_CONTROL = "X-DNS-Prefetch-Control";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-Forwarded-For
    public static final String X_FORWARDED_FOR = "X-Forwarded-For";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-Forwarded-Host
    public static final String X_FORWARDED_HOST = "X-Forwarded-Host";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-Forwarded-Proto
    public static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-Frame-Options
    public static final String X_FRAME_OPTIONS = "X-Frame-Options";

    // legacy alias of IDEMPOTENCY_KEY, https://tools.ietf.org/id/draft-idempotency-header-01.html
    public static final String X_IDEMPOTENCY_KEY = "X-Idempotency-Key";

    // https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/X-XSS-Protection
    public static final String X_XSS_PROTECTION = "X-XSS-Protection";
}
