package json.nodes;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// Printed JSON text, held in a buffer taken from a {@link JsonAllocator}.
///
/// The caller owns the buffer and hands it back with {@link #close()}.
/// Closing twice is harmless; reading after close fails with
/// `IllegalStateException`.
///
/// ## Example
/// ```java
/// try (JsonText text = Json.printUnformatted(request)) {
///     text.writeTo(connection.getOutputStream());
/// }
/// ```
public final class JsonText implements AutoCloseable {

    private final JsonAllocator owner;
    private final int length;
    private byte[] buffer;

    JsonText(byte[] buffer, int length, JsonAllocator owner) {
        this.buffer = buffer;
        this.length = length;
        this.owner = owner;
    }

    /// {@return the number of bytes of text}
    public int length() {
        return length;
    }

    /// {@return a copy of the text bytes (UTF-8 for text built from Java strings)}
    public byte[] toBytes() {
        return Arrays.copyOf(open(), length);
    }

    /// Writes the text bytes to `out`.
    ///
    /// @throws IOException if the stream fails
    public void writeTo(OutputStream out) throws IOException {
        out.write(open(), 0, length);
    }

    /// {@return `true` once the buffer has been handed back}
    public boolean isClosed() {
        return buffer == null;
    }

    /// Returns the buffer to the allocator it came from.
    @Override
    public void close() {
        if (buffer != null) {
            owner.free(buffer);
            buffer = null;
        }
    }

    /// {@return the text decoded as UTF-8}
    @Override
    public String toString() {
        return new String(open(), 0, length, StandardCharsets.UTF_8);
    }

    private byte[] open() {
        if (buffer == null) {
            throw new IllegalStateException("JsonText already released");
        }
        return buffer;
    }
}
