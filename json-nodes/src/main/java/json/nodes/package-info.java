/// A small JSON engine built on a linked tree of nodes, with every byte it
/// holds drawn from a pluggable allocator.
///
/// ## Parsing JSON documents
/// `Json.parse(byte[], int)` reads the first JSON value in a bounded byte
/// buffer and returns the root `JsonNode`, or `null` with the reason available
/// from `Json.lastError()`. `JsonEngine.parseWithDiagnostic(byte[], int)`
/// returns the reason with the result instead. Bytes after the first value
/// are ignored.
///
/// ## Building and navigating trees
/// Nodes are created with the `Json.createX` methods and linked with
/// `Json.addItemToArray` and `Json.addItemToObject`. Appending hands
/// ownership to the container, and `Json.delete(JsonNode)` releases a whole
/// tree. Members are found with `Json.getObjectItem` (ASCII case-insensitive)
/// or `Json.getObjectItemCaseSensitive`:
/// ```java
/// var doc = Json.parse(response);
/// var content = Json.getObjectItem(Json.getObjectItem(doc, "message"), "content");
/// ```
///
/// ## Generating JSON documents
/// `Json.print(JsonNode)` and its aliases produce compact text in a
/// `JsonText` that hands its buffer back to the allocator when closed.
/// `Json.toDisplayString(JsonNode, int)` produces an indented rendering for
/// logs.
///
/// ## Allocation
/// `Json.initHooks(JsonAllocator)` installs an allocator for the process-wide
/// engine; a `JsonEngine` built with `JsonEngine.builder()` carries its own.
package json.nodes;
