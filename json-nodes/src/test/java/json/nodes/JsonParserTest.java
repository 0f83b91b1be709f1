package json.nodes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JsonParserTest extends JsonNodesTestBase {

    private final CountingAllocator allocator = new CountingAllocator();
    private final JsonEngine engine = JsonEngine.builder().allocator(allocator).build();

    @Test
    void parsesMixedDocumentAndPrintsItBack() {
        String text = "{\"a\":1,\"b\":[true,false,null],\"c\":\"x\\\"y\"}";
        JsonNode root = engine.parse(text);

        assertThat(root).isNotNull();
        assertThat(root.type()).isEqualTo(JsonType.OBJECT);
        assertThat(engine.getObjectItem(root, "a").valueDouble()).isEqualTo(1.0);
        JsonNode b = engine.getObjectItem(root, "b");
        assertThat(engine.getArraySize(b)).isEqualTo(3);
        assertThat(engine.getArrayItem(b, 0).type()).isEqualTo(JsonType.TRUE);
        assertThat(engine.getArrayItem(b, 1).type()).isEqualTo(JsonType.FALSE);
        assertThat(engine.getArrayItem(b, 2).type()).isEqualTo(JsonType.NULL);
        assertThat(engine.getObjectItem(root, "c").valueString()).isEqualTo("x\"y");

        try (JsonText printed = engine.printUnformatted(root)) {
            assertThat(printed.toString()).isEqualTo(text);
        }
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
        assertThat(engine.lastError()).isNull();
    }

    @Test
    void siblingsAreDoublyLinkedInOrder() {
        JsonNode root = engine.parse("[1, 2, 3]");
        JsonNode first = root.child();
        JsonNode second = first.next();
        JsonNode third = second.next();

        assertThat(first.previous()).isNull();
        assertThat(second.previous()).isSameAs(first);
        assertThat(third.previous()).isSameAs(second);
        assertThat(third.next()).isNull();
        assertThat(root).extracting(JsonNode::valueInt).containsExactly(1, 2, 3);
        engine.delete(root);
    }

    @Test
    void emptyContainersHaveNoChildren() {
        JsonNode array = engine.parse(" [ ] ");
        JsonNode object = engine.parse("{\n}");

        assertThat(array.type()).isEqualTo(JsonType.ARRAY);
        assertThat(array.child()).isNull();
        assertThat(object.type()).isEqualTo(JsonType.OBJECT);
        assertThat(object.child()).isNull();
        engine.delete(array);
        engine.delete(object);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void unicodeEscapeBecomesSinglePlaceholder() {
        JsonNode root = engine.parse("\"A\\u0041B\"");

        assertThat(root.valueString()).isEqualTo("A?B");
        engine.delete(root);
    }

    @Test
    void truncatedUnicodeEscapeStopsAtClosingQuote() {
        JsonNode root = engine.parse("[\"\\u12\", 7]");

        assertThat(engine.getArrayItem(root, 0).valueString()).isEqualTo("?");
        assertThat(engine.getArrayItem(root, 1).valueInt()).isEqualTo(7);
        engine.delete(root);
    }

    @Test
    void simpleEscapesAreDecoded() {
        JsonNode root = engine.parse("\"\\b\\f\\n\\r\\t\\/\\\\\"");

        assertThat(root.valueString()).isEqualTo("\b\f\n\r\t/\\");
        engine.delete(root);
    }

    @ParameterizedTest
    @CsvSource({
            "42, 42.0",
            "-7, -7.0",
            "3.5, 3.5",
            "1e3, 1000.0",
            "2.5E-1, 0.25",
            "0x10, 16.0",
            "0x1p4, 16.0",
            "-0x8, -8.0"
    })
    void numbersFollowStrtodPrefixRules(String input, double expected) {
        JsonNode root = engine.parse(input);

        assertThat(root.type()).isEqualTo(JsonType.NUMBER);
        assertThat(root.valueDouble()).isCloseTo(expected, within(1e-12));
        engine.delete(root);
    }

    @Test
    void infinityAndNanAreAcceptedAfterMinus() {
        JsonNode negativeInfinity = engine.parse("-inf");
        JsonNode negativeNan = engine.parse("-nan");

        assertThat(negativeInfinity.valueDouble()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(Double.isNaN(negativeNan.valueDouble())).isTrue();
        engine.delete(negativeInfinity);
        engine.delete(negativeNan);
    }

    @Test
    void integerCacheIsTruncated() {
        JsonNode root = engine.parse("[2.9, -2.9, 1e300]");

        assertThat(engine.getArrayItem(root, 0).valueLong()).isEqualTo(2L);
        assertThat(engine.getArrayItem(root, 1).valueLong()).isEqualTo(-2L);
        assertThat(engine.getArrayItem(root, 2).valueLong()).isEqualTo(Long.MAX_VALUE);
        engine.delete(root);
    }

    @Test
    void readsOnlyTheGivenLength() {
        byte[] bytes = utf8("[1,2]garbage that is never read");
        JsonNode root = engine.parse(bytes, 5);

        assertThat(engine.getArraySize(root)).isEqualTo(2);
        engine.delete(root);
    }

    @Test
    void trailingBytesAfterFirstValueAreIgnored() {
        JsonNode root = engine.parse("{\"a\":true} {\"b\":false}");

        assertThat(engine.hasObjectItem(root, "a")).isTrue();
        assertThat(engine.hasObjectItem(root, "b")).isFalse();
        engine.delete(root);
    }

    @Test
    void literalCutByLengthIsInvalid() {
        byte[] bytes = utf8("true");

        assertThat(engine.parse(bytes, 3)).isNull();
        assertThat(engine.lastDiagnostic()).get()
                .extracting(JsonDiagnostic::error).isEqualTo(JsonError.INVALID_VALUE);
    }

    @Test
    void lengthOutsideBufferIsRejected() {
        assertThatThrownBy(() -> engine.parse(utf8("[]"), 3))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> engine.parse(utf8("[]"), -1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"a\":1                | EXPECTED_TOKEN      | Expected '}'",
            "{\"a\" 1}               | EXPECTED_TOKEN      | Expected ':'",
            "{1:2}                   | EXPECTED_TOKEN      | Not a string",
            "[1 2]                   | EXPECTED_TOKEN      | Expected ']'",
            "[1,                     | END_OF_INPUT        | Unexpected end",
            "\"abc                   | UNTERMINATED_STRING | Unterminated string",
            "[\"abc\\\"]             | UNTERMINATED_STRING | Unterminated string",
            "nul                     | INVALID_VALUE       | Invalid value",
            "@                       | INVALID_VALUE       | Invalid value",
            "[1,]                    | INVALID_VALUE       | Invalid value",
            "-x                      | MALFORMED_LITERAL   | Invalid number",
            "'{'                     | END_OF_INPUT        | Unexpected end"
    })
    void failuresAreClassifiedAndLeakNothing(String input, JsonError expected, String message) {
        JsonParseResult result = engine.parseWithDiagnostic(utf8(input), utf8(input).length);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostic().message()).isEqualTo(message);
        assertThat(result.diagnostic().error()).isEqualTo(expected);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void nullAndEmptyInputAreReported() {
        assertThat(engine.parse((byte[]) null)).isNull();
        assertThat(engine.lastError()).isEqualTo("Null input");
        assertThat(engine.parse(new byte[0])).isNull();
        assertThat(engine.lastDiagnostic()).get()
                .extracting(JsonDiagnostic::error).isEqualTo(JsonError.END_OF_INPUT);
        assertThat(engine.parse("   ")).isNull();
        assertThat(engine.lastError()).isEqualTo("Unexpected end");
    }

    @Test
    void embeddedNulEndsStringAsUnterminated() {
        byte[] bytes = {'"', 'a', 0, 'b', '"'};

        assertThat(engine.parse(bytes)).isNull();
        assertThat(engine.lastDiagnostic()).get()
                .extracting(JsonDiagnostic::error).isEqualTo(JsonError.UNTERMINATED_STRING);
    }

    @Test
    void failureInsideNestedContainersFreesEverything() {
        String input = "{\"a\":[1,{\"b\":\"text\",\"c\":[true,false]}],\"d\":{\"e\":[null,\"x\" }";

        assertThat(engine.parse(input)).isNull();
        assertThat(engine.lastError()).isEqualTo("Expected ']'");
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void successfulParseClearsPreviousError() {
        assertThat(engine.parse("[")).isNull();
        assertThat(engine.lastError()).isNotNull();

        JsonNode root = engine.parse("[]");
        assertThat(engine.lastError()).isNull();
        assertThat(engine.lastDiagnostic()).isEmpty();
        engine.delete(root);
    }

    @Test
    void diagnosticCarriesOffset() {
        JsonParseResult result = engine.parseWithDiagnostic(utf8("[1,2 x"), 6);

        assertThat(result.diagnostic().offset()).isEqualTo(5);
        assertThat(result.diagnostic().toString()).isEqualTo("Expected ']' at offset 5 (EXPECTED_TOKEN)");
    }

    @Test
    void parseOrThrowRaisesWithDiagnostic() {
        assertThatThrownBy(() -> engine.parseOrThrow(utf8("{\"k\" 1}"), 7))
                .isInstanceOf(JsonParseException.class)
                .satisfies(e -> {
                    JsonParseException ex = (JsonParseException) e;
                    assertThat(ex.error()).isEqualTo(JsonError.EXPECTED_TOKEN);
                    assertThat(ex.detail()).isEqualTo("Expected ':'");
                    assertThat(ex.offset()).isEqualTo(5);
                    assertThat(ex.getMessage()).isEqualTo("Expected ':' at offset 5");
                });
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void nestingBeyondLimitIsRejected() {
        JsonEngine shallow = JsonEngine.builder().allocator(allocator).maxDepth(3).build();

        JsonNode ok = shallow.parse("[[[1]]]");
        assertThat(ok).isNotNull();
        shallow.delete(ok);

        assertThat(shallow.parse("[[[[1]]]]")).isNull();
        assertThat(shallow.lastDiagnostic()).get()
                .extracting(JsonDiagnostic::error).isEqualTo(JsonError.NESTING_TOO_DEEP);
        assertThat(allocator.outstanding()).isZero();
    }

    @Test
    void deepDocumentWithinDefaultLimitParsesAndDeletes() {
        int depth = JsonEngine.DEFAULT_MAX_DEPTH;
        String input = "[".repeat(depth) + "]".repeat(depth);

        JsonNode root = engine.parse(input);
        assertThat(root).isNotNull();
        engine.delete(root);
        assertThat(allocator.outstanding()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"a\":1,\"b\":[true,false,null],\"c\":\"x\\\"y\"}",
            "[\"one\",{\"two\":[2,2.5]},\"three\"]",
            "{\"k\":{\"k\":{\"k\":\"v\"}}}"
    })
    void everyAllocationFailureIsCleanedUp(String input) {
        byte[] bytes = utf8(input);
        int needed = countAllocations(bytes);
        for (int budget = 0; budget < needed; budget++) {
            CountingAllocator failing = new CountingAllocator(budget);
            JsonEngine limited = JsonEngine.builder().allocator(failing).build();

            JsonParseResult result = limited.parseWithDiagnostic(bytes, bytes.length);

            assertThat(result.isSuccess()).as("budget %d", budget).isFalse();
            assertThat(result.diagnostic().error()).isEqualTo(JsonError.ALLOCATION_FAILURE);
            assertThat(result.diagnostic().message()).isEqualTo("Memory error");
            assertThat(failing.outstanding()).as("budget %d", budget).isZero();
        }
    }

    private static int countAllocations(byte[] bytes) {
        CountingAllocator counter = new CountingAllocator();
        JsonEngine counting = JsonEngine.builder().allocator(counter).build();
        JsonNode root = counting.parse(bytes);
        assertThat(root).isNotNull();
        counting.delete(root);
        return counter.allocations();
    }
}
