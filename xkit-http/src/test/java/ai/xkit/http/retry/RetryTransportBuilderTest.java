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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import ai.xkit.http.HttpClientProperties;
import ai.xkit.http.HttpClientRoundTripper;
import ai.xkit.http.RoundTripper;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RetryTransportBuilderTest {

    @Test
    void testDefaults() {
        RoundTripper next = request -> null;
        RetryTransport transport = RetryTransport.builder().next(next).build();

        assertSame(next, transport.getNext());
        assertEquals(Duration.ofMillis(200), transport.getInitialInterval());
        assertEquals(1.5d, transport.getIntervalMultiplier());
        assertEquals(0.2d, transport.getJitterFactor());
        assertEquals(Duration.ofSeconds(30), transport.getMaxInterval());
    }

    @Test
    void testDefaultNextRoundTripper() {
        try (RetryTransport transport = RetryTransport.builder().build()) {
            assertTrue(transport.getNext() instanceof HttpClientRoundTripper);
        }
    }

    @Test
    void testCloseReleasesCreatedRoundTripper() {
        RetryTransport transport = RetryTransport.builder().build();
        HttpClientRoundTripper created = (HttpClientRoundTripper) transport.getNext();
        created.getHttpClient();

        transport.close();

        assertTrue(created.isClosed());
        assertThrows(IllegalStateException.class, created::getHttpClient);
    }

    @Test
    void testCloseLeavesGivenRoundTripperOpen() {
        HttpClientRoundTripper next = mock(HttpClientRoundTripper.class);
        RetryTransport transport = RetryTransport.builder().next(next).build();

        transport.close();

        verify(next, never()).close();
    }

    @Test
    void testInitialInterval() {
        RetryTransport.Builder builder = RetryTransport.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.initialInterval(Duration.ZERO));
        assertThrows(
                IllegalArgumentException.class,
                () -> builder.initialInterval(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.initialInterval(null));
        builder.initialInterval(Duration.ofNanos(1));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.99, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void testInvalidIntervalMultiplier(double multiplier) {
        assertThrows(
                IllegalArgumentException.class,
                () -> RetryTransport.builder().intervalMultiplier(multiplier));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.0, 1.5, 10.0})
    void testValidIntervalMultiplier(double multiplier) {
        assertEquals(
                multiplier,
                RetryTransport.builder()
                        .next(request -> null)
                        .intervalMultiplier(multiplier)
                        .build()
                        .getIntervalMultiplier());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1, Double.NaN})
    void testInvalidJitterFactor(double factor) {
        assertThrows(
                IllegalArgumentException.class,
                () -> RetryTransport.builder().jitterFactor(factor));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.5, 1.0})
    void testValidJitterFactor(double factor) {
        RetryTransport.builder().jitterFactor(factor);
    }

    @Test
    void testMaxInterval() {
        RetryTransport.Builder builder = RetryTransport.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.maxInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.maxInterval(null));
        builder.maxInterval(Duration.ofNanos(1));
    }

    @Test
    void testNextRoundTripper() {
        assertThrows(NullPointerException.class, () -> RetryTransport.builder().next(null));
    }

    @Test
    void testProperties() {
        HttpClientProperties properties =
                HttpClientProperties.fromConfiguration(
                        Map.<String, Object>of(
                                "initial-interval-ms", 50,
                                "interval-multiplier", 3,
                                "jitter-factor", "0",
                                "max-interval-ms", 5000));
        RoundTripper next = request -> null;
        RetryTransport transport =
                RetryTransport.builder().next(next).properties(properties).build();

        assertSame(next, transport.getNext());
        assertEquals(Duration.ofMillis(50), transport.getInitialInterval());
        assertEquals(3.0d, transport.getIntervalMultiplier());
        assertEquals(0.0d, transport.getJitterFactor());
        assertEquals(Duration.ofMillis(5000), transport.getMaxInterval());
    }

    @Test
    void testPropertiesCreateNextRoundTripper() {
        RetryTransport.Builder builder =
                RetryTransport.builder()
                        .properties(new HttpClientProperties())
                        .properties(new HttpClientProperties());
        RetryTransport first = builder.build();
        RetryTransport second = builder.build();
        HttpClientRoundTripper firstNext = (HttpClientRoundTripper) first.getNext();
        HttpClientRoundTripper secondNext = (HttpClientRoundTripper) second.getNext();
        assertNotSame(firstNext, secondNext);

        first.close();
        assertTrue(firstNext.isClosed());
        assertFalse(secondNext.isClosed());
        second.close();
        assertTrue(secondNext.isClosed());
    }

    @Test
    void testInvalidProperties() {
        HttpClientProperties properties = new HttpClientProperties();
        properties.setJitterFactor(2);
        assertThrows(
                IllegalArgumentException.class,
                () -> RetryTransport.builder().properties(properties));

        HttpClientProperties zeroInterval = new HttpClientProperties();
        zeroInterval.setInitialIntervalMs(0);
        assertThrows(
                IllegalArgumentException.class,
                () -> RetryTransport.builder().properties(zeroInterval));
    }
}
