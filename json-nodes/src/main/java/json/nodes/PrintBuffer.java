package json.nodes;

import java.nio.charset.StandardCharsets;

// Growable output buffer backed by allocator blocks.
// Callers reserve with ensure() before writing with put().
final class PrintBuffer {

    // largest array size the JVM reliably hands out
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final JsonAllocator allocator;
    private byte[] buffer;
    private int offset;

    private PrintBuffer(JsonAllocator allocator, byte[] buffer) {
        this.allocator = allocator;
        this.buffer = buffer;
    }

    /// {@return a buffer with the given initial capacity, or `null` if the
    /// allocator is exhausted or the capacity exceeds the largest buffer}
    static PrintBuffer allocate(JsonAllocator allocator, int capacity) {
        if (capacity > MAX_CAPACITY) {
            return null;
        }
        byte[] initial = JsonEngine.allocateExact(allocator, capacity);
        return initial == null ? null : new PrintBuffer(allocator, initial);
    }

    int offset() {
        return offset;
    }

    int capacity() {
        return buffer.length;
    }

    // Makes room for `needed` more bytes. Growth takes a block of twice the
    // required size, copies the written prefix and frees the old block.
    boolean ensure(int needed) {
        if (needed > MAX_CAPACITY - offset) {
            return false;
        }
        int required = offset + needed;
        if (required <= buffer.length) {
            return true;
        }
        int newSize = required > MAX_CAPACITY / 2 ? MAX_CAPACITY : required * 2;
        byte[] grown = JsonEngine.allocateExact(allocator, newSize);
        if (grown == null) {
            return false;
        }
        System.arraycopy(buffer, 0, grown, 0, offset);
        allocator.free(buffer);
        buffer = grown;
        return true;
    }

    void put(int b) {
        buffer[offset++] = (byte) b;
    }

    void put(String ascii) {
        for (int i = 0; i < ascii.length(); i++) {
            buffer[offset++] = (byte) ascii.charAt(i);
        }
    }

    boolean append(String ascii) {
        if (!ensure(ascii.length())) {
            return false;
        }
        put(ascii);
        return true;
    }

    boolean append(char c) {
        if (!ensure(1)) {
            return false;
        }
        put(c);
        return true;
    }

    // Hands the block over to a JsonText; the buffer is unusable afterwards
    JsonText detach() {
        JsonText text = new JsonText(buffer, offset, allocator);
        buffer = null;
        return text;
    }

    // Frees the block after a failed print
    void release() {
        if (buffer != null) {
            allocator.free(buffer);
            buffer = null;
        }
    }

    @Override
    public String toString() {
        return buffer == null ? "<released>" : new String(buffer, 0, offset, StandardCharsets.UTF_8);
    }
}
