package json.nodes;

/// Signals that a JSON document could not be parsed.
///
/// The parser uses this exception to unwind; each container level deletes
/// the children it already linked before letting it pass. The public
/// `parse` methods turn it into an absent result plus a
/// {@link JsonDiagnostic}; {@link JsonEngine#parseOrThrow(byte[], int)}
/// lets it escape.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final JsonError error;
    private final String detail;
    private final int offset;

    /// Creates a parse exception with the error's default message.
    public JsonParseException(JsonError error, int offset) {
        this(error, error.defaultMessage(), offset);
    }

    /// Creates a parse exception with a specific message.
    public JsonParseException(JsonError error, String detail, int offset) {
        super(detail + " at offset " + offset);
        this.error = error;
        this.detail = detail;
        this.offset = offset;
    }

    /// Returns the failure category.
    public JsonError error() {
        return error;
    }

    /// Returns the message without position information.
    public String detail() {
        return detail;
    }

    /// Returns the byte offset at which the failure was detected.
    public int offset() {
        return offset;
    }

    /// Returns this failure as a diagnostic value.
    public JsonDiagnostic diagnostic() {
        return JsonDiagnostic.of(this);
    }
}
