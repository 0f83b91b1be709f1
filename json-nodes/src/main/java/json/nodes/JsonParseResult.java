package json.nodes;

import java.util.Optional;

/// Outcome of one parse call: exactly one of `node` and `diagnostic` is present.
///
/// Unlike {@link JsonEngine#lastError()}, the diagnostic belongs to this
/// result alone, so concurrent parses do not overwrite each other's errors.
///
/// @param node the parsed tree, owned by the caller, or `null` on failure
/// @param diagnostic the failure description, or `null` on success
public record JsonParseResult(JsonNode node, JsonDiagnostic diagnostic) {

    static JsonParseResult success(JsonNode node) {
        return new JsonParseResult(node, null);
    }

    static JsonParseResult failure(JsonDiagnostic diagnostic) {
        return new JsonParseResult(null, diagnostic);
    }

    /// {@return `true` if a tree was produced}
    public boolean isSuccess() {
        return node != null;
    }

    /// {@return the tree, if any}
    public Optional<JsonNode> tree() {
        return Optional.ofNullable(node);
    }
}
