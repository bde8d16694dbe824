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

/** Cache-Control directive names. */
public final class CacheControlDirectives {

    private CacheControlDirectives() {}

    // https://datatracker.ietf.org/doc/html/rfc8246#section-2
    public static final String IMMUTABLE = "immutable";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.1

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.8
    public static final String MAX_AGE = "max-age";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.2
    public static final String MAX_STALE = "max-stale";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.3
    public static final String MIN_FRESH = "min-fresh";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.1
    public static final String MUST_REVALIDATE = "must-revalidate";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.4

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.2
    public static final String NO_CACHE = "no-cache";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.5

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.3
    public static final String NO_STORE = "no-store";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.6

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.4
    public static final String NO_TRANSFORM = "no-transform";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.1.7
    public static final String ONLY_IF_CACHED = "only-if-cached";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.5
    public static final String PUBLIC = "public";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.6
    public static final String PRIVATE = "private";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.7
    public static final String PROXY_REVALIDATE = "proxy-revalidate";

    // https://datatracker.ietf.org/doc/html/rfc7234#section-5.2.2.9
    public static final String S_MAX_AGE = "s-maxage";

    // https://datatracker.ietf.org/doc/html/rfc5861#section-4
    public static final String STALE_IF_ERROR = "stale-if-error";

    // https://datatracker.ietf.org/doc/html/rfc5861#section-3
    public static final String STALE_WHILE_REVALIDATE = "stale-while-revalidate";
}
