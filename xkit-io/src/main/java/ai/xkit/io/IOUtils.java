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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/** Helpers for {@link InputStream}s that the JDK does not provide. */
public final class IOUtils {

    private IOUtils() {}

    /**
     * Discards whatever is left in the stream and closes it. Does nothing if the stream is null.
     *
     * <p>A failure to close is reported in preference to a failure to read, the read failure being
     * attached as suppressed.
     *
     * @param stream the stream to drain, may be null
     * @throws IOException if reading or closing the stream fails
     */
    public static void drainClose(InputStream stream) throws IOException {
        if (stream == null) {
            return;
        }
        IOException readError = null;
        try {
            stream.transferTo(OutputStream.nullOutputStream());
        } catch (IOException error) {
            readError = error;
        }
        try {
            stream.close();
        } catch (IOException closeError) {
            if (readError != null) {
                closeError.addSuppressed(readError);
            }
            throw closeError;
        }
        if (readError != null) {
            throw readError;
        }
    }

    /**
     * Reads the whole stream to memory and returns two equivalent streams yielding the same bytes.
     * The source stream is closed once read.
     *
     * @param stream the source stream, may be null
     * @return the two copies, or null if the source is null
     * @throws IOException if the source cannot be read or closed
     */
    public static Duplicate duplicate(InputStream stream) throws IOException {
        if (stream == null) {
            return null;
        }
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (stream) {
            stream.transferTo(buffer);
        }
        final byte[] bytes = buffer.toByteArray();
        return new Duplicate(new ByteArrayInputStream(bytes), new ByteArrayInputStream(bytes));
    }

    public record Duplicate(InputStream first, InputStream second) {}
}
