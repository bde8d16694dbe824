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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;

/**
 * An outgoing HTTP request.
 *
 * <p>The body is a one-shot stream. Callers that want the request to be resendable, for instance
 * by {@link ai.xkit.http.retry.RetryTransport}, either leave the body empty or provide a {@link
 * BodyRewinder}; {@link HttpRequestBuilder#content(byte[])} does both at once.
 */
@Getter
public final class HttpRequest {

    private final String method;
    private final URI uri;
    private final HttpHeaders headers;
    private final InputStream body;
    private final BodyRewinder bodyRewinder;
    private final RequestContext context;

    @Builder(toBuilder = true)
    private HttpRequest(
            String method,
            URI uri,
            HttpHeaders headers,
            InputStream body,
            BodyRewinder bodyRewinder,
            RequestContext context) {
        this.method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        this.uri = Objects.requireNonNull(uri, "uri cannot be null");
        this.headers = headers == null ? new HttpHeaders() : headers;
        this.body = body;
        this.bodyRewinder = bodyRewinder;
        this.context = context == null ? RequestContext.background() : context;
    }

    public static HttpRequest get(String uri) {
        return builder().method("GET").uri(URI.create(uri)).build();
    }

    public boolean hasBody() {
        return body != null;
    }

    /** Returns a copy of this request, with its own headers, sending the given body. */
    public HttpRequest withBody(InputStream newBody) {
        return toBuilder().headers(headers.copy()).body(newBody).build();
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static class HttpRequestBuilder {

        public HttpRequestBuilder header(String name, String value) {
            if (this.headers == null) {
                this.headers = new HttpHeaders();
            }
            this.headers.add(name, value);
            return this;
        }

        /** Sets an in-memory body, rewindable. An empty array means no body. */
        public HttpRequestBuilder content(byte[] content) {
            if (content == null || content.length == 0) {
                this.body = null;
                this.bodyRewinder = null;
            } else {
                this.body = new ByteArrayInputStream(content);
                this.bodyRewinder = BodyRewinder.ofBytes(content);
            }
            return this;
        }

        public HttpRequestBuilder content(String content) {
            return content(content == null ? null : content.getBytes(StandardCharsets.UTF_8));
        }
    }
}
