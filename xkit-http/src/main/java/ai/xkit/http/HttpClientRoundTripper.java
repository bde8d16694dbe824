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

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RoundTripper} sending requests through a {@link java.net.http.HttpClient}. The client is
 * created on first use and released by {@link #close()}.
 */
@Slf4j
public class HttpClientRoundTripper implements RoundTripper, AutoCloseable {

    // managed by the JDK client, setting them is rejected
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClientProperties httpClientProperties;
    private ExecutorService executorService;
    private HttpClient httpClient;
    private boolean closed;

    public HttpClientRoundTripper() {
        this(new HttpClientProperties());
    }

    public HttpClientRoundTripper(HttpClientProperties httpClientProperties) {
        this.httpClientProperties = httpClientProperties;
    }

    public synchronized HttpClient getHttpClient() {
        if (closed) {
            throw new IllegalStateException("round tripper is closed");
        }
        if (httpClient == null) {
            executorService = Executors.newCachedThreadPool();
            httpClient =
                    HttpClient.newBuilder()
                            .executor(executorService)
                            // no h2c upgrade on plain http
                            .version(HttpClient.Version.HTTP_1_1)
                            .connectTimeout(
                                    Duration.ofMillis(httpClientProperties.getConnectTimeoutMs()))
                            .followRedirects(
                                    httpClientProperties.isFollowRedirects()
                                            ? HttpClient.Redirect.NORMAL
                                            : HttpClient.Redirect.NEVER)
                            .build();
        }
        return httpClient;
    }

    @Override
    public HttpResponse execute(HttpRequest request) throws IOException {
        final java.net.http.HttpRequest httpRequest = toHttpRequest(request);
        if (log.isDebugEnabled()) {
            log.debug("sending request: {}", httpRequest);
        }
        try {
            final java.net.http.HttpResponse<InputStream> response =
                    getHttpClient().send(httpRequest, BodyHandlers.ofInputStream());
            if (log.isDebugEnabled()) {
                log.debug("received response: {}", response);
            }
            return HttpResponse.builder()
                    .statusCode(response.statusCode())
                    .headers(HttpHeaders.of(response.headers().map()))
                    .body(response.body())
                    .request(request)
                    .build();
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted =
                    new InterruptedIOException("Interrupted while sending " + request);
            interrupted.initCause(error);
            throw interrupted;
        }
    }

    private static java.net.http.HttpRequest toHttpRequest(HttpRequest request) {
        final java.net.http.HttpRequest.BodyPublisher bodyPublisher =
                !request.hasBody()
                        ? java.net.http.HttpRequest.BodyPublishers.noBody()
                        : java.net.http.HttpRequest.BodyPublishers.ofInputStream(
                                bodySupplier(request));
        final java.net.http.HttpRequest.Builder builder =
                java.net.http.HttpRequest.newBuilder()
                        .uri(request.getUri())
                        .method(request.getMethod(), bodyPublisher);
        request.getHeaders()
                .forEach(
                        (name, values) -> {
                            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                                log.debug("skipping restricted header {} on {}", name, request);
                                return;
                            }
                            values.forEach(value -> builder.header(name, value));
                        });
        return builder.build();
    }

    /**
     * The client subscribes to the body again when it follows a 307 or 308 redirect. The first
     * subscription gets the request body, the next ones a rewound copy of it.
     */
    private static Supplier<InputStream> bodySupplier(HttpRequest request) {
        final AtomicBoolean first = new AtomicBoolean(true);
        return () -> {
            if (first.getAndSet(false)) {
                return request.getBody();
            }
            final BodyRewinder rewinder = request.getBodyRewinder();
            if (rewinder == null) {
                return new FailingInputStream(
                        new IOException("Cannot resend the body of " + request + ", no rewinder"));
            }
            try {
                return rewinder.rewind();
            } catch (IOException error) {
                return new FailingInputStream(error);
            }
        };
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Reports an error to the body publisher, which fails the exchange with it. */
    private static final class FailingInputStream extends InputStream {
        private final IOException error;

        private FailingInputStream(IOException error) {
            this.error = error;
        }

        @Override
        public int read() throws IOException {
            throw error;
        }
    }
}
