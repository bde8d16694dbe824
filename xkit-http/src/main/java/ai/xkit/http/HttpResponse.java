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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import lombok.Builder;
import lombok.Getter;

/**
 * A received HTTP response. The body stream is owned by whoever receives the response and must be
 * closed, either directly or through {@link #close()}.
 */
@Getter
public final class HttpResponse implements Closeable {

    private final int statusCode;
    private final HttpHeaders headers;
    private final InputStream body;
    private final HttpRequest request;

    @Builder
    private HttpResponse(
            int statusCode, HttpHeaders headers, InputStream body, HttpRequest request) {
        this.statusCode = statusCode;
        this.headers = headers == null ? new HttpHeaders() : headers;
        this.body = body;
        this.request = request;
    }

    @Override
    public void close() throws IOException {
        if (body != null) {
            body.close();
        }
    }

    @Override
    public String toString() {
        return "HttpResponse{"
                + "statusCode="
                + statusCode
                + ", request="
                + request
                + ", headers="
                + headers
                + '}';
    }
}
