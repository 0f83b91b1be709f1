package json.nodes;

import java.util.logging.Logger;

import static json.nodes.JsonError.ALLOCATION_FAILURE;
import static json.nodes.JsonError.END_OF_INPUT;
import static json.nodes.JsonError.EXPECTED_TOKEN;
import static json.nodes.JsonError.INVALID_VALUE;
import static json.nodes.JsonError.MALFORMED_LITERAL;
import static json.nodes.JsonError.NESTING_TOO_DEEP;
import static json.nodes.JsonError.UNTERMINATED_STRING;

// Recursive descent over a bounded byte buffer, building linked nodes.
// Every read is checked against `length`, never against a terminator.
// Failures unwind as JsonParseException; each container deletes the
// children it linked before rethrowing, the root is deleted by parseRoot.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    // a unicode escape decodes to this single byte, the code digits are dropped
    static final byte UNICODE_PLACEHOLDER = '?';

    private final JsonEngine engine;
    private final byte[] doc;
    private final int length;
    private final int maxDepth;
    // Current offset during parsing
    int offset;

    JsonParser(JsonEngine engine, byte[] doc, int length) {
        this.engine = engine;
        this.doc = doc;
        this.length = doc == null ? 0 : length;
        this.maxDepth = engine.maxDepth();
    }

    JsonNode parseRoot() {
        if (doc == null || length == 0) {
            throw new JsonParseException(END_OF_INPUT, "Null input", 0);
        }
        JsonNode root = newNode();
        try {
            parseValue(root, 0);
        } catch (JsonParseException e) {
            engine.delete(root);
            throw e;
        }
        return root;
    }

    void parseValue(JsonNode item, int depth) {
        skipWhitespace();
        if (offset >= length) {
            throw failure(END_OF_INPUT, "Unexpected end");
        }
        if (bytesEqual("null")) {
            item.type = JsonType.NULL;
            offset += 4;
            return;
        }
        if (bytesEqual("false")) {
            item.type = JsonType.FALSE;
            offset += 5;
            return;
        }
        if (bytesEqual("true")) {
            item.type = JsonType.TRUE;
            offset += 4;
            return;
        }
        int c = doc[offset] & 0xFF;
        switch (c) {
            case '"' -> parseString(item);
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> parseNumber(item);
            case '[' -> parseArray(item, depth + 1);
            case '{' -> parseObject(item, depth + 1);
            default -> throw failure(INVALID_VALUE, "Invalid value");
        }
    }

    void parseString(JsonNode item) {
        if (offset >= length || doc[offset] != '"') {
            throw failure(EXPECTED_TOKEN, "Not a string");
        }
        int start = offset + 1;
        int end = start;
        // First pass: find the closing quote, a backslash escapes exactly one byte
        while (true) {
            if (end >= length || doc[end] == 0) {
                throw new JsonParseException(UNTERMINATED_STRING, "Unterminated string", Math.min(end, length));
            }
            if (doc[end] == '"') {
                break;
            }
            if (doc[end] == '\\') {
                end++;
            }
            end++;
        }
        // Second pass: size, then copy with escapes resolved
        byte[] value = engine.allocate(unescape(start, end, null));
        if (value == null) {
            throw failure(ALLOCATION_FAILURE, "Memory error");
        }
        unescape(start, end, value);
        item.type = JsonType.STRING;
        item.valueString = value;
        offset = end + 1; // Walk past the closing quote
    }

    // Decodes doc[from, to) into `out`, or only counts when `out` is null
    private int unescape(int from, int to, byte[] out) {
        int written = 0;
        for (int i = from; i < to; i++) {
            int c = doc[i];
            if (c == '\\' && i + 1 < to) {
                i++;
                int escaped = doc[i];
                c = switch (escaped) {
                    case 'b' -> '\b';
                    case 'f' -> '\f';
                    case 'n' -> '\n';
                    case 'r' -> '\r';
                    case 't' -> '\t';
                    case 'u' -> {
                        // the four code digits are skipped, never past the closing quote
                        i += Math.min(4, to - 1 - i);
                        yield UNICODE_PLACEHOLDER;
                    }
                    default -> escaped;
                };
            }
            if (out != null) {
                out[written] = (byte) c;
            }
            written++;
        }
        return written;
    }

    void parseNumber(JsonNode item) {
        int consumed = NumberScanner.prefixLength(doc, offset, length);
        if (consumed == 0) {
            throw failure(MALFORMED_LITERAL, "Invalid number");
        }
        item.setNumber(NumberScanner.valueOf(doc, offset, consumed));
        offset += consumed;
    }

    void parseArray(JsonNode item, int depth) {
        checkDepth(depth);
        offset++; // Walk past the '['
        skipWhitespace();
        // Check for empty case
        if (currByteEquals(']')) {
            offset++;
            item.type = JsonType.ARRAY;
            return;
        }

        JsonNode head = null;
        JsonNode current = null;
        try {
            do {
                skipWhitespace();
                JsonNode element = newNode();
                if (head == null) {
                    head = element;
                } else {
                    current.next = element;
                    element.previous = current;
                }
                current = element;

                parseValue(element, depth);
                skipWhitespace();
            } while (consume(','));

            if (!currByteEquals(']')) {
                throw failure(EXPECTED_TOKEN, "Expected ']'");
            }
            offset++;
        } catch (JsonParseException e) {
            engine.delete(head);
            throw e;
        }
        item.type = JsonType.ARRAY;
        item.child = head;
        LOG.finer(() -> "Parsed array ending at offset " + offset);
    }

    void parseObject(JsonNode item, int depth) {
        checkDepth(depth);
        offset++; // Walk past the '{'
        skipWhitespace();
        // Check for empty case
        if (currByteEquals('}')) {
            offset++;
            item.type = JsonType.OBJECT;
            return;
        }

        JsonNode head = null;
        JsonNode current = null;
        try {
            do {
                skipWhitespace();
                JsonNode member = newNode();
                if (head == null) {
                    head = member;
                } else {
                    current.next = member;
                    member.previous = current;
                }
                current = member;

                if (offset >= length) {
                    throw failure(END_OF_INPUT, "Unexpected end");
                }
                // The key is parsed as a string, then moved into the key slot
                parseString(member);
                member.key = member.valueString;
                member.valueString = null;
                member.type = JsonType.INVALID;

                // Move from name to ':'
                skipWhitespace();
                if (!currByteEquals(':')) {
                    throw failure(EXPECTED_TOKEN, "Expected ':'");
                }
                offset++;
                skipWhitespace();

                parseValue(member, depth);
                skipWhitespace();
            } while (consume(','));

            if (!currByteEquals('}')) {
                throw failure(EXPECTED_TOKEN, "Expected '}'");
            }
            offset++;
        } catch (JsonParseException e) {
            engine.delete(head);
            throw e;
        }
        item.type = JsonType.OBJECT;
        item.child = head;
        LOG.finer(() -> "Parsed object ending at offset " + offset);
    }

    // Utility functions

    private JsonNode newNode() {
        JsonNode node = engine.newNode();
        if (node == null) {
            throw failure(ALLOCATION_FAILURE, "Memory error");
        }
        return node;
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            LOG.warning(() -> "Rejecting document nested deeper than " + maxDepth + " at offset " + offset);
            throw failure(NESTING_TOO_DEEP, "Nesting too deep");
        }
    }

    // Any byte up to and including space counts as whitespace
    void skipWhitespace() {
        while (offset < length && (doc[offset] & 0xFF) <= ' ') {
            offset++;
        }
    }

    // returns true if the byte at the current offset equals `c`
    // and is within the bounds of the document
    boolean currByteEquals(char c) {
        return offset < length && doc[offset] == c;
    }

    private boolean consume(char c) {
        if (currByteEquals(c)) {
            offset++;
            return true;
        }
        return false;
    }

    // Returns true if the bytes at the current offset spell `literal`
    // and are within the bounds of the document
    boolean bytesEqual(String literal) {
        if (offset + literal.length() > length) {
            return false;
        }
        for (int index = 0; index < literal.length(); index++) {
            if (doc[offset + index] != literal.charAt(index)) {
                return false;
            }
        }
        return true;
    }

    JsonParseException failure(JsonError error, String message) {
        return new JsonParseException(error, message, offset);
    }
}
