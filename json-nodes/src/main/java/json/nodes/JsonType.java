package json.nodes;

/// The kind of value a {@link JsonNode} holds.
///
/// The kind alone decides which payload of a node is meaningful:
/// `NUMBER` uses the numeric value, `STRING` and `RAW` use the string buffer,
/// `ARRAY` and `OBJECT` use the child list. Ownership is tracked separately
/// (see {@link JsonNode#isReference()} and {@link JsonNode#isConstantKey()}).
public enum JsonType {
    /// The unset sentinel. A parsed object member sits in this state between
    /// reading its key and reading its value; deleted nodes are reset to it.
    INVALID,
    FALSE,
    TRUE,
    NULL,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    /// Preformatted text. Printed as an escaped JSON string.
    RAW
}
