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
import java.io.IOException;
import java.io.InputStream;

/**
 * Regenerates a request body from its start, so that the request can be sent again. A request
 * with a body and no rewinder is never resent.
 */
@FunctionalInterface
public interface BodyRewinder {

    InputStream rewind() throws IOException;

    static BodyRewinder ofBytes(byte[] content) {
        return () -> new ByteArrayInputStream(content);
    }
}
