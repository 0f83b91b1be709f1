package json.nodes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A JSON engine: an allocator, a nesting limit and a last-error slot,
/// plus every operation on node trees.
///
/// Engines are cheap and immutable apart from the diagnostic recorded by
/// the most recent {@link #parse(byte[], int)}. Code that parses from
/// several threads should use {@link #parseWithDiagnostic(byte[], int)},
/// whose diagnostic belongs to the call. The process-wide engine behind
/// {@link Json} is replaced by {@link Json#initHooks(JsonAllocator)}.
///
/// Trees must be deleted by an engine using the allocator that built them.
///
/// ## Example
/// ```java
/// JsonEngine engine = JsonEngine.builder().maxDepth(64).build();
/// JsonNode doc = engine.parse("{\"action\":\"read\",\"path\":\"notes.txt\"}");
/// if (doc == null) {
///     log.warning(engine.lastError());
/// } else {
///     String action = engine.getObjectItem(doc, "action").valueString();
///     engine.delete(doc);
/// }
/// ```
public final class JsonEngine {

    private static final Logger LOG = Logger.getLogger(JsonEngine.class.getName());

    /// Maximum array/object nesting accepted by the parser and the printer
    /// unless the `json.nodes.maxDepth` system property says otherwise.
    public static final int DEFAULT_MAX_DEPTH = 512;

    /// System property overriding {@link #DEFAULT_MAX_DEPTH}.
    public static final String MAX_DEPTH_PROPERTY = "json.nodes.maxDepth";

    private final JsonAllocator allocator;
    private final int maxDepth;
    private volatile JsonDiagnostic lastDiagnostic;

    private JsonEngine(JsonAllocator allocator, int maxDepth) {
        this.allocator = allocator;
        this.maxDepth = maxDepth;
        LOG.config(() -> "JsonEngine allocator=" + allocator + " maxDepth=" + maxDepth);
    }

    /// {@return a builder starting from the system allocator and the
    /// configured default depth}
    public static Builder builder() {
        return new Builder();
    }

    /// {@return an engine with the same depth limit and the given allocator}
    ///
    /// @param allocator the allocator, or `null` for {@link JsonAllocator#system()}
    public JsonEngine withAllocator(JsonAllocator allocator) {
        return new JsonEngine(allocator == null ? JsonAllocator.system() : allocator, maxDepth);
    }

    /// {@return the allocator every allocation of this engine goes through}
    public JsonAllocator allocator() {
        return allocator;
    }

    /// {@return the deepest array/object nesting this engine parses or prints}
    public int maxDepth() {
        return maxDepth;
    }

    // Allocation

    static byte[] allocateExact(JsonAllocator allocator, int size) {
        byte[] block = allocator.allocate(size);
        if (block != null && block.length != size) {
            throw new IllegalStateException(
                    "Allocator %s returned %d bytes for a request of %d".formatted(allocator, block.length, size));
        }
        return block;
    }

    byte[] allocate(int size) {
        return allocateExact(allocator, size);
    }

    JsonNode newNode() {
        byte[] block = allocate(JsonNode.NODE_SIZE);
        return block == null ? null : new JsonNode(block);
    }

    private byte[] copyOf(byte[] source) {
        byte[] copy = allocate(source.length);
        if (copy != null) {
            System.arraycopy(source, 0, copy, 0, source.length);
        }
        return copy;
    }

    // Construction

    /// {@return a new `null` node, or `null` if the allocator is exhausted}
    public JsonNode createNull() {
        return create(JsonType.NULL);
    }

    /// {@return a new `true` node, or `null` if the allocator is exhausted}
    public JsonNode createTrue() {
        return create(JsonType.TRUE);
    }

    /// {@return a new `false` node, or `null` if the allocator is exhausted}
    public JsonNode createFalse() {
        return create(JsonType.FALSE);
    }

    /// {@return a new `true` or `false` node, or `null` if the allocator is exhausted}
    public JsonNode createBool(boolean value) {
        return create(value ? JsonType.TRUE : JsonType.FALSE);
    }

    /// {@return a new number node, or `null` if the allocator is exhausted}
    /// The integer truncation of `number` is cached for printing.
    public JsonNode createNumber(double number) {
        JsonNode item = newNode();
        if (item != null) {
            item.setNumber(number);
        }
        return item;
    }

    /// {@return a new string node owning a UTF-8 copy of `string`, or `null`
    /// if the allocator is exhausted}
    ///
    /// @param string the text, or `null` for a string node without a buffer
    public JsonNode createString(String string) {
        return createText(JsonType.STRING, string);
    }

    /// {@return a new raw node owning a UTF-8 copy of `raw`, or `null` if the
    /// allocator is exhausted}
    public JsonNode createRaw(String raw) {
        return createText(JsonType.RAW, raw);
    }

    /// {@return a new empty array node, or `null` if the allocator is exhausted}
    public JsonNode createArray() {
        return create(JsonType.ARRAY);
    }

    /// {@return a new empty object node, or `null` if the allocator is exhausted}
    public JsonNode createObject() {
        return create(JsonType.OBJECT);
    }

    /// {@return a string node that borrows `bytes` instead of copying them}
    /// Deleting the node leaves `bytes` alone; the caller must keep it
    /// unchanged while the node is in use.
    public JsonNode createStringReference(byte[] bytes) {
        JsonNode item = create(JsonType.STRING);
        if (item != null) {
            item.valueString = bytes;
            item.reference = true;
        }
        return item;
    }

    /// {@return an array node whose children are the borrowed sibling list
    /// starting at `child`}
    public JsonNode createArrayReference(JsonNode child) {
        return createContainerReference(JsonType.ARRAY, child);
    }

    /// {@return an object node whose members are the borrowed sibling list
    /// starting at `child`}
    public JsonNode createObjectReference(JsonNode child) {
        return createContainerReference(JsonType.OBJECT, child);
    }

    /// {@return an array of number nodes, or `null` if `numbers` is `null`
    /// or the allocator is exhausted}
    public JsonNode createIntArray(int[] numbers) {
        if (numbers == null) {
            return null;
        }
        JsonNode array = createArray();
        for (int i = 0; array != null && i < numbers.length; i++) {
            array = appendOrDiscard(array, createNumber(numbers[i]));
        }
        return array;
    }

    /// {@return an array of number nodes, or `null` if `numbers` is `null`
    /// or the allocator is exhausted}
    public JsonNode createFloatArray(float[] numbers) {
        if (numbers == null) {
            return null;
        }
        JsonNode array = createArray();
        for (int i = 0; array != null && i < numbers.length; i++) {
            array = appendOrDiscard(array, createNumber(numbers[i]));
        }
        return array;
    }

    /// {@return an array of number nodes, or `null` if `numbers` is `null`
    /// or the allocator is exhausted}
    public JsonNode createDoubleArray(double[] numbers) {
        if (numbers == null) {
            return null;
        }
        JsonNode array = createArray();
        for (int i = 0; array != null && i < numbers.length; i++) {
            array = appendOrDiscard(array, createNumber(numbers[i]));
        }
        return array;
    }

    /// {@return an array of string nodes, or `null` if `strings` is `null`
    /// or the allocator is exhausted}
    public JsonNode createStringArray(String... strings) {
        if (strings == null) {
            return null;
        }
        JsonNode array = createArray();
        for (int i = 0; array != null && i < strings.length; i++) {
            array = appendOrDiscard(array, createString(strings[i]));
        }
        return array;
    }

    private JsonNode create(JsonType type) {
        JsonNode item = newNode();
        if (item != null) {
            item.type = type;
        }
        return item;
    }

    private JsonNode createText(JsonType type, String text) {
        JsonNode item = create(type);
        if (item != null && text != null) {
            item.valueString = copyOf(text.getBytes(StandardCharsets.UTF_8));
            if (item.valueString == null) {
                delete(item);
                return null;
            }
        }
        return item;
    }

    private JsonNode createContainerReference(JsonType type, JsonNode child) {
        JsonNode item = create(type);
        if (item != null) {
            item.child = child;
            item.reference = true;
        }
        return item;
    }

    // the array survives only if `item` could be created
    private JsonNode appendOrDiscard(JsonNode array, JsonNode item) {
        if (item == null) {
            delete(array);
            return null;
        }
        addItemToArray(array, item);
        return array;
    }

    // Linking

    /// Appends `item` to the children of `array`; `array` now owns `item`.
    ///
    /// `item` must not belong to another container.
    ///
    /// @return `false` if either argument is `null`
    public boolean addItemToArray(JsonNode array, JsonNode item) {
        if (array == null || item == null) {
            return false;
        }
        JsonNode tail = array.child;
        if (tail == null) {
            array.child = item;
        } else {
            while (tail.next != null) {
                tail = tail.next;
            }
            tail.next = item;
            item.previous = tail;
        }
        return true;
    }

    /// Appends `item` to `object` under an owned copy of `key`.
    ///
    /// @return `false` if an argument is `null` or the key cannot be allocated
    public boolean addItemToObject(JsonNode object, String key, JsonNode item) {
        return addItemToObject(object, key, item, false);
    }

    /// Appends `item` to `object` under a constant key. The key bytes come
    /// from the heap rather than the allocator and are never freed by
    /// {@link #delete(JsonNode)}.
    ///
    /// @return `false` if an argument is `null`
    public boolean addItemToObjectCS(JsonNode object, String key, JsonNode item) {
        return addItemToObject(object, key, item, true);
    }

    private boolean addItemToObject(JsonNode object, String key, JsonNode item, boolean constantKey) {
        if (object == null || key == null || item == null) {
            return false;
        }
        byte[] encoded = key.getBytes(StandardCharsets.UTF_8);
        byte[] newKey = constantKey ? encoded : copyOf(encoded);
        if (newKey == null) {
            return false;
        }
        if (!item.constantKey && item.key != null) {
            allocator.free(item.key);
        }
        item.key = newKey;
        item.constantKey = constantKey;
        return addItemToArray(object, item);
    }

    /// Appends to `array` a reference node sharing the payload and children
    /// of `item` without owning them. `item` keeps its owner.
    ///
    /// @return `false` if an argument is `null` or the allocator is exhausted
    public boolean addItemReferenceToArray(JsonNode array, JsonNode item) {
        if (array == null) {
            return false;
        }
        return addItemToArray(array, referenceTo(item));
    }

    /// Appends to `object`, under an owned copy of `key`, a reference node
    /// sharing the payload and children of `item` without owning them.
    ///
    /// @return `false` if an argument is `null` or the allocator is exhausted
    public boolean addItemReferenceToObject(JsonNode object, String key, JsonNode item) {
        if (object == null || key == null) {
            return false;
        }
        JsonNode reference = referenceTo(item);
        if (addItemToObject(object, key, reference)) {
            return true;
        }
        delete(reference);
        return false;
    }

    private JsonNode referenceTo(JsonNode item) {
        if (item == null) {
            return null;
        }
        JsonNode reference = create(item.type);
        if (reference != null) {
            reference.valueString = item.valueString;
            reference.valueDouble = item.valueDouble;
            reference.valueLong = item.valueLong;
            reference.child = item.child;
            reference.reference = true;
        }
        return reference;
    }

    /// {@return the new `null` member, or `null` on failure}
    public JsonNode addNullToObject(JsonNode object, String name) {
        return attach(object, name, createNull());
    }

    /// {@return the new `true` member, or `null` on failure}
    public JsonNode addTrueToObject(JsonNode object, String name) {
        return attach(object, name, createTrue());
    }

    /// {@return the new `false` member, or `null` on failure}
    public JsonNode addFalseToObject(JsonNode object, String name) {
        return attach(object, name, createFalse());
    }

    /// {@return the new boolean member, or `null` on failure}
    public JsonNode addBoolToObject(JsonNode object, String name, boolean value) {
        return attach(object, name, createBool(value));
    }

    /// {@return the new number member, or `null` on failure}
    public JsonNode addNumberToObject(JsonNode object, String name, double number) {
        return attach(object, name, createNumber(number));
    }

    /// {@return the new string member, or `null` on failure}
    public JsonNode addStringToObject(JsonNode object, String name, String string) {
        return attach(object, name, createString(string));
    }

    /// {@return the new raw member, or `null` on failure}
    public JsonNode addRawToObject(JsonNode object, String name, String raw) {
        return attach(object, name, createRaw(raw));
    }

    /// {@return the new empty object member, or `null` on failure}
    public JsonNode addObjectToObject(JsonNode object, String name) {
        return attach(object, name, createObject());
    }

    /// {@return the new empty array member, or `null` on failure}
    public JsonNode addArrayToObject(JsonNode object, String name) {
        return attach(object, name, createArray());
    }

    private JsonNode attach(JsonNode object, String name, JsonNode item) {
        if (addItemToObject(object, name, item)) {
            return item;
        }
        delete(item);
        return null;
    }

    // Access

    /// {@return the number of children of `array`, zero for `null`}
    public int getArraySize(JsonNode array) {
        return array == null ? 0 : array.size();
    }

    /// {@return the child at `index`, or `null` if `array` is `null` or the
    /// index is negative or out of range}
    public JsonNode getArrayItem(JsonNode array, int index) {
        if (array == null || index < 0) {
            return null;
        }
        JsonNode c = array.child;
        while (c != null && index > 0) {
            c = c.next;
            index--;
        }
        return c;
    }

    /// {@return the first member whose key equals `key` ignoring ASCII case,
    /// or `null`}
    public JsonNode getObjectItem(JsonNode object, String key) {
        return findMember(object, key, false);
    }

    /// {@return the first member whose key equals `key` exactly, or `null`}
    public JsonNode getObjectItemCaseSensitive(JsonNode object, String key) {
        return findMember(object, key, true);
    }

    /// {@return `true` if {@link #getObjectItem(JsonNode, String)} finds a member}
    public boolean hasObjectItem(JsonNode object, String key) {
        return getObjectItem(object, key) != null;
    }

    private static JsonNode findMember(JsonNode object, String key, boolean caseSensitive) {
        if (object == null || key == null) {
            return null;
        }
        byte[] wanted = key.getBytes(StandardCharsets.UTF_8);
        for (JsonNode c = object.child; c != null; c = c.next) {
            if (c.keyEquals(wanted, caseSensitive)) {
                return c;
            }
        }
        return null;
    }

    // Deletion, duplication, comparison

    /// Deletes `item` and every sibling after it, with their subtrees.
    ///
    /// Children are skipped for reference nodes, string buffers are kept for
    /// reference nodes, and constant keys are never freed. Every node block
    /// goes back to the allocator and the node is reset to
    /// {@link JsonType#INVALID}. Deleting `null` or an already deleted node
    /// does nothing. Works with an explicit stack, so depth is not limited
    /// by the call stack.
    public void delete(JsonNode item) {
        if (item == null) {
            return;
        }
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(item);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            while (node != null && node.isLive()) {
                JsonNode next = node.next;
                if (!node.reference && node.child != null) {
                    pending.push(node.child);
                }
                if (!node.reference && node.valueString != null) {
                    allocator.free(node.valueString);
                }
                if (!node.constantKey && node.key != null) {
                    allocator.free(node.key);
                }
                allocator.free(node.block);
                clear(node);
                node = next;
            }
        }
    }

    private static void clear(JsonNode node) {
        node.block = null;
        node.next = null;
        node.previous = null;
        node.child = null;
        node.type = JsonType.INVALID;
        node.reference = false;
        node.constantKey = false;
        node.key = null;
        node.valueString = null;
        node.valueDouble = 0;
        node.valueLong = 0;
    }

    /// Pairs a source container with its copy while duplicating.
    private record Frame(JsonNode source, JsonNode target) {}

    /// {@return an independent deep copy of `item` and its whole subtree, or
    /// `null` if `item` is `null` or the allocator is exhausted}
    ///
    /// The copy owns all of its strings, keys and children, including those
    /// `item` merely references. The copy's root has no key and no siblings.
    public JsonNode duplicate(JsonNode item) {
        if (item == null) {
            return null;
        }
        JsonNode root = copyNode(item, false);
        if (root == null) {
            return null;
        }
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(item, root));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            JsonNode tail = null;
            for (JsonNode c = frame.source().child; c != null; c = c.next) {
                JsonNode copy = copyNode(c, true);
                if (copy == null) {
                    LOG.fine("Allocator exhausted while duplicating; partial copy released");
                    delete(root);
                    return null;
                }
                if (tail == null) {
                    frame.target().child = copy;
                } else {
                    tail.next = copy;
                    copy.previous = tail;
                }
                tail = copy;
                if (c.child != null) {
                    pending.push(new Frame(c, copy));
                }
            }
        }
        return root;
    }

    private JsonNode copyNode(JsonNode source, boolean withKey) {
        JsonNode copy = create(source.type);
        if (copy == null) {
            return null;
        }
        copy.valueDouble = source.valueDouble;
        copy.valueLong = source.valueLong;
        if (source.valueString != null) {
            copy.valueString = copyOf(source.valueString);
            if (copy.valueString == null) {
                delete(copy);
                return null;
            }
        }
        if (withKey && source.key != null) {
            copy.key = copyOf(source.key);
            if (copy.key == null) {
                delete(copy);
                return null;
            }
        }
        return copy;
    }

    /// {@return `true` if both nodes are present and of the same type}
    ///
    /// This is a shallow check: values and children are not compared, and
    /// `caseSensitive` has no effect. Use
    /// {@link #compareDeep(JsonNode, JsonNode, boolean)} for structural equality.
    public boolean compare(JsonNode a, JsonNode b, boolean caseSensitive) {
        return a != null && b != null && a.type == b.type;
    }

    /// {@return `true` if both trees have the same shape and content}
    ///
    /// Types must match; numbers compare by value (`NaN` equals `NaN`);
    /// strings compare byte for byte; array elements and object members
    /// compare in order, member keys honouring `caseSensitive`. Trees nested
    /// beyond {@link #maxDepth()} compare unequal.
    public boolean compareDeep(JsonNode a, JsonNode b, boolean caseSensitive) {
        return equalTrees(a, b, caseSensitive, 0);
    }

    private boolean equalTrees(JsonNode a, JsonNode b, boolean caseSensitive, int level) {
        if (a == null || b == null || a.type != b.type) {
            return false;
        }
        switch (a.type) {
            case NUMBER:
                return a.valueDouble == b.valueDouble
                        || Double.isNaN(a.valueDouble) && Double.isNaN(b.valueDouble);
            case STRING:
            case RAW:
                return Arrays.equals(a.valueString, b.valueString);
            case ARRAY:
            case OBJECT:
                if (level >= maxDepth) {
                    LOG.warning(() -> "Comparison stopped at depth " + maxDepth);
                    return false;
                }
                JsonNode x = a.child;
                JsonNode y = b.child;
                for (; x != null && y != null; x = x.next, y = y.next) {
                    if (a.type == JsonType.OBJECT && !x.keyEquals(y.key, caseSensitive)) {
                        return false;
                    }
                    if (!equalTrees(x, y, caseSensitive, level + 1)) {
                        return false;
                    }
                }
                return x == null && y == null;
            default:
                return true;
        }
    }

    // Parsing

    /// {@return the tree for the UTF-8 encoding of `text`, or `null`}
    /// @see #parse(byte[], int)
    public JsonNode parse(String text) {
        return text == null ? parse(null, 0) : parse(text.getBytes(StandardCharsets.UTF_8));
    }

    /// {@return the tree for all of `bytes`, or `null`}
    /// @see #parse(byte[], int)
    public JsonNode parse(byte[] bytes) {
        return parse(bytes, bytes == null ? 0 : bytes.length);
    }

    /// Parses the first JSON value in `bytes[0, length)`. Bytes after that
    /// value are ignored.
    ///
    /// On failure returns `null` and records a diagnostic readable through
    /// {@link #lastError()} until the next parse on this engine. No node
    /// allocated by a failed parse stays allocated.
    ///
    /// @param bytes the input, or `null`
    /// @param length the number of bytes to read. Within `bytes`.
    /// @return the tree, owned by the caller, or `null`
    /// @throws IndexOutOfBoundsException if `length` is negative or exceeds
    ///         `bytes.length`
    public JsonNode parse(byte[] bytes, int length) {
        JsonParseResult result = parseWithDiagnostic(bytes, length);
        lastDiagnostic = result.diagnostic();
        return result.node();
    }

    /// Parses like {@link #parse(byte[], int)} but returns the diagnostic
    /// with the result instead of recording it on the engine.
    ///
    /// @throws IndexOutOfBoundsException if `length` is negative or exceeds
    ///         `bytes.length`
    public JsonParseResult parseWithDiagnostic(byte[] bytes, int length) {
        try {
            return JsonParseResult.success(parseOrThrow(bytes, length));
        } catch (JsonParseException e) {
            LOG.fine(() -> "Parse failed: " + e.getMessage());
            return JsonParseResult.failure(e.diagnostic());
        }
    }

    /// Parses like {@link #parse(byte[], int)} but reports failure by
    /// throwing. No node stays allocated when it throws.
    ///
    /// @throws JsonParseException if the input is not a JSON value
    /// @throws IndexOutOfBoundsException if `length` is negative or exceeds
    ///         `bytes.length`
    public JsonNode parseOrThrow(byte[] bytes, int length) {
        if (bytes != null) {
            Objects.checkFromIndexSize(0, length, bytes.length);
        }
        return new JsonParser(this, bytes, length).parseRoot();
    }

    /// {@return the message of the most recent failed parse on this engine,
    /// or `null` if the most recent parse succeeded or none happened}
    public String lastError() {
        JsonDiagnostic diagnostic = lastDiagnostic;
        return diagnostic == null ? null : diagnostic.message();
    }

    /// {@return the full diagnostic behind {@link #lastError()}}
    public Optional<JsonDiagnostic> lastDiagnostic() {
        return Optional.ofNullable(lastDiagnostic);
    }

    // Printing

    /// {@return the compact text of `item`, or `null` if `item` is `null`,
    /// the allocator is exhausted, or the tree nests deeper than
    /// {@link #maxDepth()}}
    /// Identical to {@link #printUnformatted(JsonNode)}.
    public JsonText print(JsonNode item) {
        return printUnformatted(item);
    }

    /// {@return the compact text of `item`, or `null` on failure}
    public JsonText printUnformatted(JsonNode item) {
        return JsonPrinter.print(item, allocator, JsonPrinter.DEFAULT_CAPACITY, 0, maxDepth);
    }

    /// {@return the compact text of `item`, or `null` on failure}
    /// A `prebuffer` larger than the largest array the JVM hands out also
    /// gives `null`.
    ///
    /// @param prebuffer the initial buffer size; values below one use the default
    /// @param format accepted for compatibility; the output is always compact
    public JsonText printBuffered(JsonNode item, int prebuffer, boolean format) {
        int capacity = prebuffer > 0 ? prebuffer : JsonPrinter.DEFAULT_CAPACITY;
        return JsonPrinter.print(item, allocator, capacity, 0, maxDepth);
    }

    /// {@return an indented rendering of `item` suitable for display, or
    /// `null` on failure}
    /// Arrays and objects place each child on its own line, indented by
    /// `indent` spaces per level; members read `"key": value`.
    ///
    /// @throws IllegalArgumentException if `indent` is negative
    public String toDisplayString(JsonNode item, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        try (JsonText text = JsonPrinter.print(item, allocator, JsonPrinter.DEFAULT_CAPACITY, indent, maxDepth)) {
            return text == null ? null : text.toString();
        }
    }

    @Override
    public String toString() {
        return "JsonEngine[allocator=" + allocator + ", maxDepth=" + maxDepth + "]";
    }

    /// Configures a {@link JsonEngine}.
    public static final class Builder {

        private JsonAllocator allocator = JsonAllocator.system();
        private int maxDepth = configuredMaxDepth();

        private Builder() {}

        /// Sets the allocator; `null` selects {@link JsonAllocator#system()}.
        public Builder allocator(JsonAllocator allocator) {
            this.allocator = allocator == null ? JsonAllocator.system() : allocator;
            return this;
        }

        /// Sets the deepest array/object nesting accepted.
        ///
        /// @throws IllegalArgumentException if `maxDepth` is less than one
        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public JsonEngine build() {
            return new JsonEngine(allocator, maxDepth);
        }
    }

    static int configuredMaxDepth() {
        String value = System.getProperty(MAX_DEPTH_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_MAX_DEPTH;
        }
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth >= 1) {
                return depth;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        LOG.warning(() -> "Ignoring " + MAX_DEPTH_PROPERTY + "=" + value + "; using " + DEFAULT_MAX_DEPTH);
        return DEFAULT_MAX_DEPTH;
    }
}
