package json.nodes;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/// One JSON value, or one member of a JSON object.
///
/// Nodes form a tree of doubly linked sibling lists: an `ARRAY` or `OBJECT`
/// node points at its first child, and each child points at its next and
/// previous siblings in insertion order. Object members carry a key; keys
/// need not be unique.
///
/// Nodes are created and linked through {@link JsonEngine} (or the static
/// {@link Json} facade) and released with {@link JsonEngine#delete(JsonNode)}.
/// Once appended to a container, a node belongs to that container. A node
/// has no internal locking: share a tree between threads only read-only.
///
/// Strings and keys are held as UTF-8 bytes exactly as parsed or built; the
/// `String` accessors decode them on each call.
public final class JsonNode implements Iterable<JsonNode> {

    /// Bytes requested from the allocator for every node.
    public static final int NODE_SIZE = 64;

    // allocator block accounting for this node; null once deleted
    byte[] block;

    JsonNode next;
    JsonNode previous;
    JsonNode child;

    JsonType type = JsonType.INVALID;
    // children and string are borrowed, not owned
    boolean reference;
    // key is borrowed, not owned
    boolean constantKey;

    byte[] key;
    byte[] valueString;
    double valueDouble;
    long valueLong;

    JsonNode(byte[] block) {
        this.block = block;
    }

    void setNumber(double number) {
        type = JsonType.NUMBER;
        valueDouble = number;
        valueLong = (long) number;
    }

    boolean isLive() {
        return block != null;
    }

    /// {@return the kind of this node}
    public JsonType type() {
        return type;
    }

    /// {@return `true` if this node is of the given kind}
    public boolean is(JsonType kind) {
        return type == kind;
    }

    /// {@return `true` if this node's children and string are borrowed and
    /// left alone when the node is deleted}
    public boolean isReference() {
        return reference;
    }

    /// {@return `true` if this member's key is borrowed and left alone when
    /// the node is deleted}
    public boolean isConstantKey() {
        return constantKey;
    }

    /// {@return the next sibling, or `null`}
    public JsonNode next() {
        return next;
    }

    /// {@return the previous sibling, or `null`}
    public JsonNode previous() {
        return previous;
    }

    /// {@return the first child of an array or object, or `null`}
    public JsonNode child() {
        return child;
    }

    /// {@return the member key decoded as UTF-8, or `null` if this node is
    /// not an object member}
    public String key() {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    /// {@return a copy of the raw key bytes, or `null`}
    public byte[] keyBytes() {
        return key == null ? null : key.clone();
    }

    /// {@return the string value decoded as UTF-8 for `STRING` and `RAW`
    /// nodes, otherwise `null`}
    public String valueString() {
        if (type != JsonType.STRING && type != JsonType.RAW || valueString == null) {
            return null;
        }
        return new String(valueString, StandardCharsets.UTF_8);
    }

    /// {@return a copy of the raw string bytes for `STRING` and `RAW` nodes,
    /// otherwise `null`}
    public byte[] valueBytes() {
        if (type != JsonType.STRING && type != JsonType.RAW || valueString == null) {
            return null;
        }
        return valueString.clone();
    }

    /// {@return the numeric value of a `NUMBER` node, otherwise `0`}
    public double valueDouble() {
        return type == JsonType.NUMBER ? valueDouble : 0;
    }

    /// {@return the numeric value truncated to a `long`}
    /// Values outside the `long` range saturate; `NaN` gives zero.
    public long valueLong() {
        return type == JsonType.NUMBER ? valueLong : 0;
    }

    /// {@return the numeric value truncated to an `int`}
    /// Values outside the `int` range saturate; `NaN` gives zero.
    public int valueInt() {
        return type == JsonType.NUMBER ? (int) valueDouble : 0;
    }

    /// {@return the number of children of an array or object}
    public int size() {
        int size = 0;
        for (JsonNode c = child; c != null; c = c.next) {
            size++;
        }
        return size;
    }

    /// {@return an iterator over the children in sibling order}
    @Override
    public Iterator<JsonNode> iterator() {
        return new Iterator<>() {
            private JsonNode cursor = child;

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public JsonNode next() {
                if (cursor == null) {
                    throw new NoSuchElementException();
                }
                JsonNode current = cursor;
                cursor = cursor.next;
                return current;
            }
        };
    }

    boolean keyEquals(byte[] other, boolean caseSensitive) {
        if (key == null || other == null) {
            return false;
        }
        if (caseSensitive) {
            return Arrays.equals(key, other);
        }
        if (key.length != other.length) {
            return false;
        }
        for (int i = 0; i < key.length; i++) {
            if (lower(key[i]) != lower(other[i])) {
                return false;
            }
        }
        return true;
    }

    // ASCII only, like strcasecmp in the C locale
    private static int lower(byte b) {
        int c = b & 0xFF;
        return c >= 'A' && c <= 'Z' ? c + ('a' - 'A') : c;
    }

    /// {@return the compact JSON text of this node}
    /// The text is rendered on the heap, outside any installed allocator.
    /// A tree nested deeper than {@link JsonEngine#DEFAULT_MAX_DEPTH} (or the
    /// `json.nodes.maxDepth` system property) renders as `<TYPE>`, e.g. `<ARRAY>`.
    @Override
    public String toString() {
        return JsonPrinter.render(this);
    }
}
