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

import static ai.xkit.http.util.ConfigurationUtils.getBoolean;
import static ai.xkit.http.util.ConfigurationUtils.getDouble;
import static ai.xkit.http.util.ConfigurationUtils.getLong;

import ai.xkit.http.util.ConfigurationUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings of an HTTP client chain: the retry backoff policy and the underlying JDK client.
 *
 * <p>Read from a configuration map or a YAML file with kebab-case keys:
 *
 * <pre>
 * initial-interval-ms: 200
 * interval-multiplier: 1.5
 * jitter-factor: 0.2
 * max-interval-ms: 30000
 * connect-timeout-ms: 30000
 * follow-redirects: true
 * </pre>
 *
 * Values are checked when applied to a {@link ai.xkit.http.retry.RetryTransport.Builder}.
 */
@Data
@NoArgsConstructor
public class HttpClientProperties {

    public static final String INITIAL_INTERVAL_MS = "initial-interval-ms";
    public static final String INTERVAL_MULTIPLIER = "interval-multiplier";
    public static final String JITTER_FACTOR = "jitter-factor";
    public static final String MAX_INTERVAL_MS = "max-interval-ms";
    public static final String CONNECT_TIMEOUT_MS = "connect-timeout-ms";
    public static final String FOLLOW_REDIRECTS = "follow-redirects";

    private static final Set<String> KEYS =
            Set.of(
                    INITIAL_INTERVAL_MS,
                    INTERVAL_MULTIPLIER,
                    JITTER_FACTOR,
                    MAX_INTERVAL_MS,
                    CONNECT_TIMEOUT_MS,
                    FOLLOW_REDIRECTS);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private long initialIntervalMs = 200;
    private double intervalMultiplier = 1.5d;
    private double jitterFactor = 0.2d;
    private long maxIntervalMs = 30_000;
    private long connectTimeoutMs = 30_000;
    private boolean followRedirects = true;

    public static HttpClientProperties fromConfiguration(Map<String, Object> configuration) {
        HttpClientProperties properties = new HttpClientProperties();
        if (configuration == null) {
            return properties;
        }
        ConfigurationUtils.validateKeys(configuration, KEYS, () -> "http client configuration");
        properties.setInitialIntervalMs(
                getLong(INITIAL_INTERVAL_MS, properties.getInitialIntervalMs(), configuration));
        properties.setIntervalMultiplier(
                getDouble(INTERVAL_MULTIPLIER, properties.getIntervalMultiplier(), configuration));
        properties.setJitterFactor(
                getDouble(JITTER_FACTOR, properties.getJitterFactor(), configuration));
        properties.setMaxIntervalMs(
                getLong(MAX_INTERVAL_MS, properties.getMaxIntervalMs(), configuration));
        properties.setConnectTimeoutMs(
                getLong(CONNECT_TIMEOUT_MS, properties.getConnectTimeoutMs(), configuration));
        properties.setFollowRedirects(
                getBoolean(FOLLOW_REDIRECTS, properties.isFollowRedirects(), configuration));
        return properties;
    }

    @SuppressWarnings("unchecked")
    public static HttpClientProperties load(Path file) throws IOException {
        Map<String, Object> configuration = YAML_MAPPER.readValue(file.toFile(), Map.class);
        return fromConfiguration(configuration);
    }
}
