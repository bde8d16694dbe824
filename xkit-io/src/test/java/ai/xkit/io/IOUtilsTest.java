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
package ai.xkit.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class IOUtilsTest {

    @Test
    void testDrainCloseNull() throws Exception {
        IOUtils.drainClose(null);
    }

    @Test
    void testDrainCloseConsumesAndCloses() throws Exception {
        TrackingInputStream stream = new TrackingInputStream("some payload");
        IOUtils.drainClose(stream);
        assertEquals(0, stream.available());
        assertTrue(stream.closed);
    }

    @Test
    void testDrainCloseReadError() throws Exception {
        InputStream stream = mock(InputStream.class);
        IOException readError = new IOException("read");
        when(stream.read(any(byte[].class), anyInt(), anyInt())).thenThrow(readError);
        when(stream.transferTo(any())).thenCallRealMethod();

        IOException error = assertThrows(IOException.class, () -> IOUtils.drainClose(stream));
        assertSame(readError, error);
        verify(stream).close();
    }

    @Test
    void testDrainCloseCloseErrorWins() throws Exception {
        InputStream stream = mock(InputStream.class);
        IOException readError = new IOException("read");
        IOException closeError = new IOException("close");
        when(stream.read(any(byte[].class), anyInt(), anyInt())).thenThrow(readError);
        when(stream.transferTo(any())).thenCallRealMethod();
        doThrow(closeError).when(stream).close();

        IOException error = assertThrows(IOException.class, () -> IOUtils.drainClose(stream));
        assertSame(closeError, error);
        assertSame(readError, error.getSuppressed()[0]);
    }

    @Test
    void testDuplicateNull() throws Exception {
        assertNull(IOUtils.duplicate(null));
    }

    @Test
    void testDuplicate() throws Exception {
        TrackingInputStream source = new TrackingInputStream("payload");
        IOUtils.Duplicate duplicate = IOUtils.duplicate(source);

        assertTrue(source.closed);
        assertArrayEquals(
                "payload".getBytes(StandardCharsets.UTF_8), duplicate.first().readAllBytes());
        assertArrayEquals(
                "payload".getBytes(StandardCharsets.UTF_8), duplicate.second().readAllBytes());
    }

    @Test
    void testDuplicateReadError() throws Exception {
        InputStream source = mock(InputStream.class);
        when(source.read(any(byte[].class), anyInt(), anyInt())).thenThrow(new IOException());
        when(source.transferTo(any())).thenCallRealMethod();

        assertThrows(IOException.class, () -> IOUtils.duplicate(source));
        verify(source).close();
    }

    private static class TrackingInputStream extends ByteArrayInputStream {
        private boolean closed;

        TrackingInputStream(String content) {
            super(content.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
