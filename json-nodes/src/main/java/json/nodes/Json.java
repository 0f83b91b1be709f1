package json.nodes;

import java.util.Optional;
import java.util.logging.Logger;

/// Static entry points over a process-wide {@link JsonEngine}.
///
/// Every method delegates to {@link #engine()}. {@link #initHooks(JsonAllocator)}
/// swaps that engine for one using another allocator; call it before any
/// tree exists, since trees must be deleted through the allocator that
/// built them.
///
/// The `isX` predicates accept `null` and then answer `false`.
///
/// ## Example
/// ```java
/// JsonNode request = Json.createObject();
/// Json.addStringToObject(request, "model", "llama3");
/// Json.addFalseToObject(request, "stream");
/// try (JsonText text = Json.printUnformatted(request)) {
///     send(text.toBytes());
/// }
/// Json.delete(request);
/// ```
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    private static volatile JsonEngine engine = JsonEngine.builder().build();

    private Json() {}

    /// Installs `allocator` for all later operations through this class.
    /// `null` restores {@link JsonAllocator#system()}. The depth limit is
    /// kept and the last error is cleared.
    public static void initHooks(JsonAllocator allocator) {
        JsonEngine replacement = engine.withAllocator(allocator);
        engine = replacement;
        LOG.config(() -> "Installed allocator " + replacement.allocator());
    }

    /// {@return the engine currently behind this class}
    public static JsonEngine engine() {
        return engine;
    }

    // Parsing and diagnostics

    public static JsonNode parse(String text) {
        return engine.parse(text);
    }

    public static JsonNode parse(byte[] bytes) {
        return engine.parse(bytes);
    }

    public static JsonNode parse(byte[] bytes, int length) {
        return engine.parse(bytes, length);
    }

    public static JsonParseResult parseWithDiagnostic(byte[] bytes, int length) {
        return engine.parseWithDiagnostic(bytes, length);
    }

    public static JsonNode parseOrThrow(byte[] bytes, int length) {
        return engine.parseOrThrow(bytes, length);
    }

    /// {@return the message of the most recent failed parse through this
    /// class, or `null`}
    public static String lastError() {
        return engine.lastError();
    }

    public static Optional<JsonDiagnostic> lastDiagnostic() {
        return engine.lastDiagnostic();
    }

    // Printing

    public static JsonText print(JsonNode item) {
        return engine.print(item);
    }

    public static JsonText printUnformatted(JsonNode item) {
        return engine.printUnformatted(item);
    }

    public static JsonText printBuffered(JsonNode item, int prebuffer, boolean format) {
        return engine.printBuffered(item, prebuffer, format);
    }

    public static String toDisplayString(JsonNode item, int indent) {
        return engine.toDisplayString(item, indent);
    }

    // Lifecycle

    public static void delete(JsonNode item) {
        engine.delete(item);
    }

    public static JsonNode duplicate(JsonNode item) {
        return engine.duplicate(item);
    }

    public static boolean compare(JsonNode a, JsonNode b, boolean caseSensitive) {
        return engine.compare(a, b, caseSensitive);
    }

    public static boolean compareDeep(JsonNode a, JsonNode b, boolean caseSensitive) {
        return engine.compareDeep(a, b, caseSensitive);
    }

    // Construction

    public static JsonNode createNull() {
        return engine.createNull();
    }

    public static JsonNode createTrue() {
        return engine.createTrue();
    }

    public static JsonNode createFalse() {
        return engine.createFalse();
    }

    public static JsonNode createBool(boolean value) {
        return engine.createBool(value);
    }

    public static JsonNode createNumber(double number) {
        return engine.createNumber(number);
    }

    public static JsonNode createString(String string) {
        return engine.createString(string);
    }

    public static JsonNode createRaw(String raw) {
        return engine.createRaw(raw);
    }

    public static JsonNode createArray() {
        return engine.createArray();
    }

    public static JsonNode createObject() {
        return engine.createObject();
    }

    public static JsonNode createStringReference(byte[] bytes) {
        return engine.createStringReference(bytes);
    }

    public static JsonNode createArrayReference(JsonNode child) {
        return engine.createArrayReference(child);
    }

    public static JsonNode createObjectReference(JsonNode child) {
        return engine.createObjectReference(child);
    }

    public static JsonNode createIntArray(int[] numbers) {
        return engine.createIntArray(numbers);
    }

    public static JsonNode createFloatArray(float[] numbers) {
        return engine.createFloatArray(numbers);
    }

    public static JsonNode createDoubleArray(double[] numbers) {
        return engine.createDoubleArray(numbers);
    }

    public static JsonNode createStringArray(String... strings) {
        return engine.createStringArray(strings);
    }

    // Linking

    public static boolean addItemToArray(JsonNode array, JsonNode item) {
        return engine.addItemToArray(array, item);
    }

    public static boolean addItemToObject(JsonNode object, String key, JsonNode item) {
        return engine.addItemToObject(object, key, item);
    }

    public static boolean addItemToObjectCS(JsonNode object, String key, JsonNode item) {
        return engine.addItemToObjectCS(object, key, item);
    }

    public static boolean addItemReferenceToArray(JsonNode array, JsonNode item) {
        return engine.addItemReferenceToArray(array, item);
    }

    public static boolean addItemReferenceToObject(JsonNode object, String key, JsonNode item) {
        return engine.addItemReferenceToObject(object, key, item);
    }

    public static JsonNode addNullToObject(JsonNode object, String name) {
        return engine.addNullToObject(object, name);
    }

    public static JsonNode addTrueToObject(JsonNode object, String name) {
        return engine.addTrueToObject(object, name);
    }

    public static JsonNode addFalseToObject(JsonNode object, String name) {
        return engine.addFalseToObject(object, name);
    }

    public static JsonNode addBoolToObject(JsonNode object, String name, boolean value) {
        return engine.addBoolToObject(object, name, value);
    }

    public static JsonNode addNumberToObject(JsonNode object, String name, double number) {
        return engine.addNumberToObject(object, name, number);
    }

    public static JsonNode addStringToObject(JsonNode object, String name, String string) {
        return engine.addStringToObject(object, name, string);
    }

    public static JsonNode addRawToObject(JsonNode object, String name, String raw) {
        return engine.addRawToObject(object, name, raw);
    }

    public static JsonNode addObjectToObject(JsonNode object, String name) {
        return engine.addObjectToObject(object, name);
    }

    public static JsonNode addArrayToObject(JsonNode object, String name) {
        return engine.addArrayToObject(object, name);
    }

    // Access

    public static int getArraySize(JsonNode array) {
        return engine.getArraySize(array);
    }

    public static JsonNode getArrayItem(JsonNode array, int index) {
        return engine.getArrayItem(array, index);
    }

    public static JsonNode getObjectItem(JsonNode object, String key) {
        return engine.getObjectItem(object, key);
    }

    public static JsonNode getObjectItemCaseSensitive(JsonNode object, String key) {
        return engine.getObjectItemCaseSensitive(object, key);
    }

    public static boolean hasObjectItem(JsonNode object, String key) {
        return engine.hasObjectItem(object, key);
    }

    // Type predicates

    public static boolean isInvalid(JsonNode item) {
        return item != null && item.type() == JsonType.INVALID;
    }

    public static boolean isFalse(JsonNode item) {
        return item != null && item.type() == JsonType.FALSE;
    }

    public static boolean isTrue(JsonNode item) {
        return item != null && item.type() == JsonType.TRUE;
    }

    public static boolean isBool(JsonNode item) {
        return isTrue(item) || isFalse(item);
    }

    public static boolean isNull(JsonNode item) {
        return item != null && item.type() == JsonType.NULL;
    }

    public static boolean isNumber(JsonNode item) {
        return item != null && item.type() == JsonType.NUMBER;
    }

    public static boolean isString(JsonNode item) {
        return item != null && item.type() == JsonType.STRING;
    }

    public static boolean isArray(JsonNode item) {
        return item != null && item.type() == JsonType.ARRAY;
    }

    public static boolean isObject(JsonNode item) {
        return item != null && item.type() == JsonType.OBJECT;
    }

    public static boolean isRaw(JsonNode item) {
        return item != null && item.type() == JsonType.RAW;
    }
}
