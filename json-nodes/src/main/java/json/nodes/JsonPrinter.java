package json.nodes;

import java.util.logging.Logger;

// Serializes a node tree into a PrintBuffer.
// With indent == 0 the output is compact; every public print entry point
// uses that mode. A positive indent is used only by toDisplayString.
final class JsonPrinter {

    private static final Logger LOG = Logger.getLogger(JsonPrinter.class.getName());

    static final int DEFAULT_CAPACITY = 256;

    private static final byte[] EMPTY = new byte[0];
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final PrintBuffer out;
    private final int indent;
    private final int maxDepth;

    private JsonPrinter(PrintBuffer out, int indent, int maxDepth) {
        this.out = out;
        this.indent = indent;
        this.maxDepth = maxDepth;
    }

    /// {@return the text of `node`, or `null` if the node is absent or
    /// invalid, the allocator is exhausted, or nesting exceeds `maxDepth`}
    static JsonText print(JsonNode node, JsonAllocator allocator, int capacity, int indent, int maxDepth) {
        if (node == null) {
            return null;
        }
        PrintBuffer out = PrintBuffer.allocate(allocator, capacity);
        if (out == null) {
            LOG.fine(() -> "No initial print buffer of " + capacity + " bytes");
            return null;
        }
        if (!new JsonPrinter(out, indent, maxDepth).printValue(node, 0)) {
            LOG.fine(() -> "Printing stopped at byte " + out.offset() + " of " + out.capacity());
            out.release();
            return null;
        }
        return out.detach();
    }

    // Compact text on the heap, outside any installed allocator.
    // Bounded like a default engine; deeper trees render as "<TYPE>".
    static String render(JsonNode node) {
        try (JsonText text = print(node, JsonAllocator.system(), DEFAULT_CAPACITY, 0, JsonEngine.configuredMaxDepth())) {
            return text == null ? "<" + node.type() + ">" : text.toString();
        }
    }

    private boolean printValue(JsonNode item, int level) {
        return switch (item.type) {
            case NULL -> out.append("null");
            case FALSE -> out.append("false");
            case TRUE -> out.append("true");
            case NUMBER -> printNumber(item);
            case STRING, RAW -> printString(item.valueString);
            case ARRAY -> printArray(item, level + 1);
            case OBJECT -> printObject(item, level + 1);
            case INVALID -> false;
        };
    }

    private boolean printNumber(JsonNode item) {
        double d = item.valueDouble;
        String text;
        if (!Double.isFinite(d)) {
            text = "null";
        } else if (d == (double) item.valueLong) {
            text = Long.toString(item.valueLong);
        } else {
            text = Double.toString(d);
        }
        return out.append(text);
    }

    private boolean printString(byte[] value) {
        byte[] s = value == null ? EMPTY : value;
        long needed = 2;
        for (byte b : s) {
            needed += escapedLength(b & 0xFF);
        }
        if (needed > Integer.MAX_VALUE || !out.ensure((int) needed)) {
            return false;
        }
        out.put('"');
        for (byte b : s) {
            int c = b & 0xFF;
            switch (c) {
                case '"' -> escape('"');
                case '\\' -> escape('\\');
                case '\b' -> escape('b');
                case '\f' -> escape('f');
                case '\n' -> escape('n');
                case '\r' -> escape('r');
                case '\t' -> escape('t');
                default -> {
                    if (c < 0x20) {
                        out.put('\\');
                        out.put('u');
                        out.put('0');
                        out.put('0');
                        out.put(HEX[c >> 4]);
                        out.put(HEX[c & 0xF]);
                    } else {
                        out.put(c);
                    }
                }
            }
        }
        out.put('"');
        return true;
    }

    private static int escapedLength(int c) {
        return switch (c) {
            case '"', '\\', '\b', '\f', '\n', '\r', '\t' -> 2;
            default -> c < 0x20 ? 6 : 1;
        };
    }

    private void escape(char c) {
        out.put('\\');
        out.put(c);
    }

    private boolean printArray(JsonNode item, int level) {
        if (!checkDepth(level) || !out.append('[')) {
            return false;
        }
        boolean pretty = indent > 0 && item.child != null;
        for (JsonNode element = item.child; element != null; element = element.next) {
            if (pretty && !newline(level)) {
                return false;
            }
            if (!printValue(element, level)) {
                return false;
            }
            if (element.next != null && !out.append(',')) {
                return false;
            }
        }
        if (pretty && !newline(level - 1)) {
            return false;
        }
        return out.append(']');
    }

    private boolean printObject(JsonNode item, int level) {
        if (!checkDepth(level) || !out.append('{')) {
            return false;
        }
        boolean pretty = indent > 0 && item.child != null;
        for (JsonNode member = item.child; member != null; member = member.next) {
            if (pretty && !newline(level)) {
                return false;
            }
            if (!printString(member.key) || !out.append(pretty ? ": " : ":")) {
                return false;
            }
            if (!printValue(member, level)) {
                return false;
            }
            if (member.next != null && !out.append(',')) {
                return false;
            }
        }
        if (pretty && !newline(level - 1)) {
            return false;
        }
        return out.append('}');
    }

    private boolean newline(int level) {
        int width = level * indent;
        if (!out.ensure(1 + width)) {
            return false;
        }
        out.put('\n');
        for (int i = 0; i < width; i++) {
            out.put(' ');
        }
        return true;
    }

    private boolean checkDepth(int level) {
        if (level > maxDepth) {
            LOG.warning(() -> "Refusing to print a tree nested deeper than " + maxDepth);
            return false;
        }
        return true;
    }
}
