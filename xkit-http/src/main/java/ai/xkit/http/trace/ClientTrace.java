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
package ai.xkit.http.trace;

import java.util.function.Consumer;
import lombok.Builder;
import lombok.Getter;

/**
 * Hooks run at various stages of an outgoing HTTP request. Any hook may be null.
 *
 * <p>Hooks are called synchronously on the thread executing the request, they must return
 * quickly. An exception thrown by a hook aborts the request and reaches the caller.
 */
@Getter
@Builder
public class ClientTrace {

    /** A trace without any hook. */
    public static final ClientTrace NONE = ClientTrace.builder().build();

    /** Called before a request is sent again. */
    private final Consumer<RetryInfo> onRetry;

    public void retry(RetryInfo info) {
        if (onRetry != null) {
            onRetry.accept(info);
        }
    }
}
