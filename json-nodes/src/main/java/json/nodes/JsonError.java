package json.nodes;

/// The ways a parse can fail.
public enum JsonError {
    /// The allocator returned no block.
    ALLOCATION_FAILURE("Memory error"),
    /// A number started but no numeric prefix could be scanned.
    MALFORMED_LITERAL("Invalid number"),
    /// A string ran into a NUL byte or the end of the buffer before its closing quote.
    UNTERMINATED_STRING("Unterminated string"),
    /// A structural token (`"`, `:`, `,`, `]`, `}`) was required and not found.
    EXPECTED_TOKEN("Expected token"),
    /// The byte at a value position starts no JSON value.
    INVALID_VALUE("Invalid value"),
    /// The input is absent, empty, or ended where a value was required.
    END_OF_INPUT("Unexpected end"),
    /// Arrays and objects are nested deeper than the engine's maximum depth.
    NESTING_TOO_DEEP("Nesting too deep");

    private final String defaultMessage;

    JsonError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    /// {@return the message used when a failure carries no more specific text}
    public String defaultMessage() {
        return defaultMessage;
    }
}
