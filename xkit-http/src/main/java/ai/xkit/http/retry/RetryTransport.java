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
package ai.xkit.http.retry;

import ai.xkit.http.HttpClientProperties;
import ai.xkit.http.HttpClientRoundTripper;
import ai.xkit.http.HttpDates;
import ai.xkit.http.HttpHeaderNames;
import ai.xkit.http.HttpHeaders;
import ai.xkit.http.HttpRequest;
import ai.xkit.http.HttpResponse;
import ai.xkit.http.RequestContext;
import ai.xkit.http.RoundTripper;
import ai.xkit.http.trace.ClientTrace;
import ai.xkit.http.trace.RetryInfo;
import ai.xkit.io.IOUtils;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RoundTripper} retrying requests according to the HTTP semantics of
 * https://datatracker.ietf.org/doc/html/rfc9110.
 *
 * <p>A request is retried when:
 *
 * <ul>
 *   <li>its method is idempotent (GET, HEAD, PUT, DELETE, OPTIONS, TRACE) or it carries an {@code
 *       Idempotency-Key} or {@code X-Idempotency-Key} header,
 *   <li>its body is absent or can be rewound through a {@link ai.xkit.http.BodyRewinder},
 *   <li>the response status is 408, 425, 429, 500, 502, 503, 504, or 413 along with a {@code
 *       Retry-After} header.
 * </ul>
 *
 * Between two attempts the transport waits for the delay given by the {@code Retry-After}
 * response header if any, otherwise for an exponentially growing, jittered interval. There is no
 * limit on the number of attempts: retries stop once a response is not retryable or the request
 * context is cancelled, in which case the last response is returned.
 *
 * <p>Only transport errors of the next round tripper are reported as exceptions, and they are
 * never retried.
 *
 * <p>Instances are immutable and can be shared. Closing a transport releases the {@link
 * HttpClientRoundTripper} it created when no next round tripper was given; a round tripper passed
 * to {@link Builder#next(RoundTripper)} stays owned by the caller.
 */
@Slf4j
@Getter
public final class RetryTransport implements RoundTripper, AutoCloseable {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(200);
    public static final double DEFAULT_INTERVAL_MULTIPLIER = 1.5d;
    public static final double DEFAULT_JITTER_FACTOR = 0.2d;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(30);

    // https://datatracker.ietf.org/doc/html/rfc9110#section-9.2.2
    private static final Set<String> IDEMPOTENT_METHODS =
            Set.of("GET", "HEAD", "PUT", "DELETE", "OPTIONS", "TRACE");

    private static final Pattern DELAY_SECONDS = Pattern.compile("[+-]?\\d+");

    private final RoundTripper next;
    private final Duration initialInterval;
    private final double intervalMultiplier;
    private final double jitterFactor;
    private final Duration maxInterval;

    @Getter(AccessLevel.NONE)
    private final DoubleSupplier random;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    // created by the builder, closed with this transport
    @Getter(AccessLevel.NONE)
    private final HttpClientRoundTripper ownedRoundTripper;

    private RetryTransport(Builder builder) {
        if (builder.next != null) {
            this.next = builder.next;
            this.ownedRoundTripper = null;
        } else {
            this.ownedRoundTripper =
                    builder.properties != null
                            ? new HttpClientRoundTripper(builder.properties)
                            : new HttpClientRoundTripper();
            this.next = ownedRoundTripper;
        }
        this.initialInterval = builder.initialInterval;
        this.intervalMultiplier = builder.intervalMultiplier;
        this.jitterFactor = builder.jitterFactor;
        this.maxInterval = builder.maxInterval;
        this.random = builder.random;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public HttpResponse execute(HttpRequest request) throws IOException {
        return execute(request, ClientTrace.NONE);
    }

    /**
     * Executes the request, retrying it as long as it is retryable.
     *
     * @param request the request
     * @param trace hooks notified of each retry
     * @return the last response obtained, its body left open
     * @throws IOException the transport error of the next round tripper, as is
     */
    public HttpResponse execute(HttpRequest request, ClientTrace trace) throws IOException {
        Objects.requireNonNull(request, "request cannot be null");
        if (trace == null) {
            trace = ClientTrace.NONE;
        }
        final RequestContext context = request.getContext();
        final boolean requestRetryable = isIdempotent(request) && isRewindable(request);
        int retryCount = 0;
        Duration interval = min(initialInterval, maxInterval);

        while (true) {
            final HttpResponse response = next.execute(request);

            if (!requestRetryable || !isRetryable(response)) {
                return response;
            }

            if (request.getBodyRewinder() != null) {
                final InputStream body;
                try {
                    body = request.getBodyRewinder().rewind();
                } catch (IOException | RuntimeException error) {
                    log.warn(
                            "Cannot rewind the body of {}, returning the last response ({}): {}",
                            request,
                            response.getStatusCode(),
                            error.toString());
                    return response;
                }
                request = request.withBody(body);
            }

            final Duration wait = computeWaitDuration(interval, response.getHeaders());
            log.info(
                    "Retrying request {} in {}, status code: {}",
                    request,
                    wait,
                    response.getStatusCode());
            if (awaitCancellation(context, wait)) {
                log.debug(
                        "Request {} cancelled while waiting to retry, returning the last response",
                        request);
                closeRewoundBody(request);
                return response;
            }
            discard(response);

            interval = nextInterval(interval);
            retryCount++;
            trace.retry(new RetryInfo(retryCount, response.getStatusCode()));
        }
    }

    static boolean isIdempotent(HttpRequest request) {
        if (IDEMPOTENT_METHODS.contains(request.getMethod())) {
            return true;
        }
        final HttpHeaders headers = request.getHeaders();
        return hasValue(headers, HttpHeaderNames.IDEMPOTENCY_KEY)
                || hasValue(headers, HttpHeaderNames.X_IDEMPOTENCY_KEY);
    }

    static boolean isRewindable(HttpRequest request) {
        return !request.hasBody() || request.getBodyRewinder() != null;
    }

    static boolean isRetryable(HttpResponse response) {
        switch (response.getStatusCode()) {
            case 408: // Request Timeout
            case 425: // Too Early
            case 429: // Too Many Requests
            case 500: // Internal Server Error
            case 502: // Bad Gateway
            case 503: // Service Unavailable
            case 504: // Gateway Timeout
                return true;
            case 413: // Content Too Large, only if the server says when to come back
                return hasValue(response.getHeaders(), HttpHeaderNames.RETRY_AFTER);
            default:
                return false;
        }
    }

    /**
     * Computes how long to wait before the next attempt. A valid Retry-After header wins over the
     * backoff interval; otherwise the interval is randomized in {@code [interval - delta, interval
     * + delta)}, with {@code delta = jitterFactor * interval}.
     */
    Duration computeWaitDuration(Duration interval, HttpHeaders headers) {
        final String retryAfter = headers.get(HttpHeaderNames.RETRY_AFTER);
        if (retryAfter != null && !retryAfter.isBlank()) {
            final Duration hint = parseRetryAfter(retryAfter.trim());
            if (hint != null) {
                return hint.isNegative() ? Duration.ZERO : hint;
            }
        }

        if (jitterFactor == 0.0d) {
            return interval;
        }

        final double intervalNanos = nanos(interval);
        final double delta = jitterFactor * intervalNanos;
        final double minInterval = intervalNanos - delta;
        return Duration.ofNanos((long) (minInterval + random.getAsDouble() * delta * 2));
    }

    Duration nextInterval(Duration interval) {
        final double next = nanos(interval) * intervalMultiplier;
        if (next >= nanos(maxInterval)) {
            return maxInterval;
        }
        return Duration.ofNanos((long) next);
    }

    private Duration parseRetryAfter(String retryAfter) {
        if (DELAY_SECONDS.matcher(retryAfter).matches()) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfter));
            } catch (NumberFormatException tooLarge) {
                log.debug("Ignoring out of range Retry-After header '{}'", retryAfter);
                return null;
            }
        }
        try {
            final Instant date = HttpDates.parse(retryAfter);
            return Duration.between(clock.instant(), date);
        } catch (DateTimeParseException invalid) {
            log.debug("Ignoring invalid Retry-After header '{}'", retryAfter);
            return null;
        }
    }

    private static boolean awaitCancellation(RequestContext context, Duration wait) {
        try {
            return context.awaitCancellation(wait);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static void closeRewoundBody(HttpRequest request) {
        if (!request.hasBody()) {
            return;
        }
        try {
            request.getBody().close();
        } catch (IOException error) {
            log.debug("Failed to close the unsent body of {}: {}", request, error.toString());
        }
    }

    private static void discard(HttpResponse response) {
        try {
            IOUtils.drainClose(response.getBody());
        } catch (IOException error) {
            log.debug("Failed to discard the body of {}: {}", response, error.toString());
        }
    }

    private static boolean hasValue(HttpHeaders headers, String name) {
        final String value = headers.get(name);
        return value != null && !value.isEmpty();
    }

    private static double nanos(Duration duration) {
        return duration.getSeconds() * 1e9d + duration.getNano();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public void close() {
        if (ownedRoundTripper != null) {
            ownedRoundTripper.close();
        }
    }

    /**
     * Builds a {@link RetryTransport}. Every setter checks its argument straight away and throws
     * on an invalid value, so that misconfigurations surface at startup.
     */
    public static final class Builder {

        private RoundTripper next;
        private Duration initialInterval = DEFAULT_INITIAL_INTERVAL;
        private double intervalMultiplier = DEFAULT_INTERVAL_MULTIPLIER;
        private double jitterFactor = DEFAULT_JITTER_FACTOR;
        private Duration maxInterval = DEFAULT_MAX_INTERVAL;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private Clock clock = Clock.systemUTC();
        private HttpClientProperties properties;

        private Builder() {}

        /** Round tripper executing each attempt, a {@link HttpClientRoundTripper} if not set. */
        public Builder next(RoundTripper next) {
            this.next = Objects.requireNonNull(next, "next round tripper cannot be null");
            return this;
        }

        /** Interval before the first retry. Must be positive. */
        public Builder initialInterval(Duration initialInterval) {
            if (initialInterval == null
                    || initialInterval.isNegative()
                    || initialInterval.isZero()) {
                throw new IllegalArgumentException(
                        "invalid initial interval value: " + initialInterval);
            }
            this.initialInterval = initialInterval;
            return this;
        }

        /** Growth factor of the interval after each retry. Must be at least 1.0. */
        public Builder intervalMultiplier(double intervalMultiplier) {
            if (!(intervalMultiplier >= 1.0d) || Double.isInfinite(intervalMultiplier)) {
                throw new IllegalArgumentException(
                        "invalid interval multiplier value: " + intervalMultiplier);
            }
            this.intervalMultiplier = intervalMultiplier;
            return this;
        }

        /** Share of the interval randomized in both directions. Must be within [0.0, 1.0]. */
        public Builder jitterFactor(double jitterFactor) {
            if (!(jitterFactor >= 0.0d && jitterFactor <= 1.0d)) {
                throw new IllegalArgumentException("invalid jitter factor value: " + jitterFactor);
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        /** Cap of the interval, once reached it no longer grows. Must be positive. */
        public Builder maxInterval(Duration maxInterval) {
            if (maxInterval == null || maxInterval.isNegative() || maxInterval.isZero()) {
                throw new IllegalArgumentException("invalid max interval value: " + maxInterval);
            }
            this.maxInterval = maxInterval;
            return this;
        }

        /**
         * Applies the backoff settings of the properties. Unless {@link #next(RoundTripper)} is
         * called, attempts go through a {@link HttpClientRoundTripper} built from them too.
         */
        public Builder properties(HttpClientProperties properties) {
            Objects.requireNonNull(properties, "properties cannot be null");
            initialInterval(Duration.ofMillis(properties.getInitialIntervalMs()));
            intervalMultiplier(properties.getIntervalMultiplier());
            jitterFactor(properties.getJitterFactor());
            maxInterval(Duration.ofMillis(properties.getMaxIntervalMs()));
            this.properties = properties;
            return this;
        }

        Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random);
            return this;
        }

        Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public RetryTransport build() {
            return new RetryTransport(this);
        }
    }
}
