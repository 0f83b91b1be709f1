package json.nodes;

import java.util.Objects;

/// Describes why a parse failed.
///
/// @param error the failure category
/// @param message a short human readable description, e.g. `Expected ':'`
/// @param offset the byte offset into the input at which the failure was detected
public record JsonDiagnostic(JsonError error, String message, int offset) {

    public JsonDiagnostic {
        Objects.requireNonNull(error);
        Objects.requireNonNull(message);
    }

    static JsonDiagnostic of(JsonParseException failure) {
        return new JsonDiagnostic(failure.error(), failure.detail(), failure.offset());
    }

    @Override
    public String toString() {
        return "%s at offset %d (%s)".formatted(message, offset, error);
    }
}
