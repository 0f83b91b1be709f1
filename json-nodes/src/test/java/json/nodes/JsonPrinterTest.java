package json.nodes;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPrinterTest extends JsonNodesTestBase {

    private final CountingAllocator allocator = new CountingAllocator();
    private final JsonEngine engine = JsonEngine.builder().allocator(allocator).build();

    private String compact(JsonNode node) {
        try (JsonText text = engine.print(node)) {
            return text == null ? null : text.toString();
        }
    }

    @Test
    void integralNumbersPrintWithoutFraction() {
        JsonNode three = engine.createNumber(3.0);
        JsonNode negative = engine.createNumber(-12.0);

        assertThat(compact(three)).isEqualTo("3");
        assertThat(compact(negative)).isEqualTo("-12");
        engine.delete(three);
        engine.delete(negative);
    }

    @Test
    void fractionalNumbersRoundTrip() {
        JsonNode node = engine.createNumber(3.5);

        String printed = compact(node);
        assertThat(printed).contains("3.5");
        JsonNode reparsed = engine.parse(printed);
        assertThat(reparsed.valueDouble()).isEqualTo(3.5);
        engine.delete(node);
        engine.delete(reparsed);
    }

    @Test
    void nonFiniteNumbersPrintAsNull() {
        JsonNode array = engine.createDoubleArray(new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY});

        assertThat(compact(array)).isEqualTo("[null,null,null]");
        engine.delete(array);
    }

    @Test
    void stringsAreEscapedBytewise() {
        JsonNode node = engine.createString("q\"b\\s/\b\f\n\r\t\u0001\u001f é");

        assertThat(compact(node)).isEqualTo("\"q\\\"b\\\\s/\\b\\f\\n\\r\\t\\u0001\\u001f é\"");
        engine.delete(node);
    }

    @Test
    void nullStringPrintsEmpty() {
        JsonNode node = engine.createString(null);

        assertThat(compact(node)).isEqualTo("\"\"");
        engine.delete(node);
    }

    @Test
    void rawPrintsAsEscapedString() {
        JsonNode node = engine.createRaw("{\"pre\":1}");

        assertThat(node.type()).isEqualTo(JsonType.RAW);
        assertThat(compact(node)).isEqualTo("\"{\\\"pre\\\":1}\"");
        engine.delete(node);
    }

    @Test
    void allEntryPointsProduceIdenticalCompactText() {
        JsonNode root = engine.parse("{ \"list\" : [ 1 , 2.25 , \"x\" ] , \"obj\" : { \"t\" : true } }");

        try (JsonText print = engine.print(root);
             JsonText unformatted = engine.printUnformatted(root);
             JsonText bufferedFormatted = engine.printBuffered(root, 1, true);
             JsonText bufferedDefault = engine.printBuffered(root, 0, false)) {
            String expected = "{\"list\":[1,2.25,\"x\"],\"obj\":{\"t\":true}}";
            assertThat(print.toString()).isEqualTo(expected);
            assertThat(unformatted.toString()).isEqualTo(expected);
            assertThat(bufferedFormatted.toString()).isEqualTo(expected);
            assertThat(bufferedDefault.toString()).isEqualTo(expected);
        }
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void bufferGrowsBeyondInitialCapacity() {
        JsonNode array = engine.createArray();
        for (int i = 0; i < 200; i++) {
            engine.addItemToArray(array, engine.createString("element-" + i));
        }

        try (JsonText text = engine.printBuffered(array, 8, false)) {
            assertThat(text.length()).isGreaterThan(2_000);
            assertThat(text.toString()).startsWith("[\"element-0\",").endsWith(",\"element-199\"]");
        }
        engine.delete(array);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void allocationFailureDuringPrintReturnsNullAndLeaksNothing() {
        CountingAllocator building = new CountingAllocator();
        JsonEngine builder = JsonEngine.builder().allocator(building).build();
        JsonNode array = builder.createStringArray("x".repeat(300), "y".repeat(300));

        // the tree is built; only the print buffer may be refused now
        CountingAllocator refusing = new CountingAllocator(1);
        JsonEngine printer = JsonEngine.builder().allocator(refusing).build();
        assertThat(printer.print(array)).isNull();
        assertThat(refusing.outstanding()).isZero();

        CountingAllocator none = new CountingAllocator(0);
        assertThat(JsonEngine.builder().allocator(none).build().printUnformatted(array)).isNull();

        builder.delete(array);
        assertThat(building.outstanding()).isZero();
    }

    @Test
    void invalidAndAbsentNodesDoNotPrint() {
        assertThat(engine.print(null)).isNull();

        JsonNode deleted = engine.createTrue();
        engine.delete(deleted);
        assertThat(deleted.type()).isEqualTo(JsonType.INVALID);
        assertThat(engine.print(deleted)).isNull();
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void printingBeyondDepthLimitFails() {
        JsonEngine shallow = JsonEngine.builder().allocator(allocator).maxDepth(2).build();
        JsonNode root = engine.parse("[[[]]]");

        assertThat(shallow.print(root)).isNull();
        assertThat(allocator.outstanding()).isEqualTo(3);
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void displayStringIndentsNestedContainers() {
        JsonNode root = engine.parse("{\"name\":\"demo\",\"tags\":[\"a\",\"b\"],\"empty\":{},\"none\":[]}");

        assertThat(engine.toDisplayString(root, 2)).isEqualTo("""
                {
                  "name": "demo",
                  "tags": [
                    "a",
                    "b"
                  ],
                  "empty": {},
                  "none": []
                }""");
        assertThat(engine.toDisplayString(root, 0)).isEqualTo(root.toString());
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void negativeIndentIsRejected() {
        JsonNode node = engine.createNull();

        assertThatThrownBy(() -> engine.toDisplayString(node, -1))
                .isInstanceOf(IllegalArgumentException.class);
        engine.delete(node);
    }

    private JsonNode nestedArrays(int levels) {
        JsonNode root = engine.createArray();
        JsonNode cursor = root;
        for (int i = 1; i < levels; i++) {
            JsonNode next = engine.createArray();
            engine.addItemToArray(cursor, next);
            cursor = next;
        }
        return root;
    }

    @Test
    void toStringOfVeryDeepTreeFallsBackToTypeMarker() {
        JsonNode root = nestedArrays(100_000);

        assertThat(root.toString()).isEqualTo("<ARRAY>");
        assertThat(engine.print(root)).isNull();
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void toStringRendersUpToDefaultDepth() {
        int depth = JsonEngine.DEFAULT_MAX_DEPTH;
        JsonNode atLimit = nestedArrays(depth);
        JsonNode beyond = nestedArrays(depth + 1);

        assertThat(atLimit.toString()).isEqualTo("[".repeat(depth) + "]".repeat(depth));
        assertThat(beyond.toString()).isEqualTo("<ARRAY>");
        engine.delete(atLimit);
        engine.delete(beyond);
    }

    @Test
    void prebufferBeyondLargestArrayGivesNull() {
        JsonNode node = engine.createNull();
        int before = allocator.allocations();

        assertThat(engine.printBuffered(node, Integer.MAX_VALUE, false)).isNull();
        assertThat(allocator.allocations()).isEqualTo(before);
        engine.delete(node);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void nodeToStringUsesHeapNotAllocator() {
        JsonNode root = engine.parse("[1,\"two\"]");
        int before = allocator.allocations();

        assertThat(root.toString()).isEqualTo("[1,\"two\"]");
        assertThat(allocator.allocations()).isEqualTo(before);
        engine.delete(root);
    }

    @Test
    void textIsReleasedOnceAndUnreadableAfterClose() throws IOException {
        JsonNode node = engine.createString("payload");
        JsonText text = engine.print(node);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        text.writeTo(out);
        assertThat(out.toString(java.nio.charset.StandardCharsets.UTF_8)).isEqualTo("\"payload\"");
        assertThat(text.toBytes()).hasSize(9);
        assertThat(text.isClosed()).isFalse();

        text.close();
        text.close();
        assertThat(text.isClosed()).isTrue();
        assertThat(allocator.frees()).isEqualTo(1);
        assertThatThrownBy(text::toString)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("JsonText already released");
        engine.delete(node);
        assertThat(allocator.outstanding()).isZero();
    }
}
