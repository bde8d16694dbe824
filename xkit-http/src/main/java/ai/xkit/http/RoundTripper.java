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

/**
 * Executes a single HTTP transaction: sends the request and returns the response, whatever its
 * status code. Implementations may be chained, each one decorating the next.
 */
@FunctionalInterface
public interface RoundTripper {

    /**
     * @param request the request to send
     * @return the response, its body left for the caller to consume and close
     * @throws IOException if no response could be obtained (network failure, DNS failure...)
     */
    HttpResponse execute(HttpRequest request) throws IOException;
}
