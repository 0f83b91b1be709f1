package json.nodes;

/// The allocate/free pair every node, string, key and print buffer goes through.
///
/// An allocator hands out zero-filled blocks. Returning `null` from
/// {@link #allocate(int)} signals exhaustion; the engine then reports
/// failure (an absent node, an absent text, or
/// {@link JsonError#ALLOCATION_FAILURE} from the parser) and releases
/// whatever it had already taken for the failed operation.
///
/// Blocks are returned through {@link #free(byte[])} exactly once, to the
/// allocator that was installed when they were freed. Swap allocators only
/// before any tree exists, see {@link Json#initHooks(JsonAllocator)}.
public interface JsonAllocator {

    /// {@return a zero-filled block of exactly `size` bytes, or `null` when
    /// the allocator cannot satisfy the request}
    ///
    /// @param size the block size in bytes. Zero or positive.
    byte[] allocate(int size);

    /// Releases a block obtained from {@link #allocate(int)}.
    ///
    /// @param block the block. Never `null`.
    void free(byte[] block);

    /// {@return the default allocator, backed by the Java heap}
    /// Its `free` is a no-op; the garbage collector reclaims released blocks.
    static JsonAllocator system() {
        return SystemAllocator.INSTANCE;
    }
}

enum SystemAllocator implements JsonAllocator {
    INSTANCE;

    @Override
    public byte[] allocate(int size) {
        return new byte[size];
    }

    @Override
    public void free(byte[] block) {
        // reclaimed by the garbage collector
    }

    @Override
    public String toString() {
        return "SystemAllocator";
    }
}
