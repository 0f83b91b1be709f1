package json.nodes;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Base class for all json-nodes tests.
/// - Emits an INFO banner per test.
/// - Provides helpers for fixtures and UTF-8 input.
public class JsonNodesTestBase extends JsonNodesLoggingConfig {

    static final Logger LOG = Logger.getLogger("json.nodes");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    static byte[] fixture(String name) throws IOException {
        Path base = Path.of(System.getProperty("json.nodes.test.resources"), "fixtures");
        return Files.readAllBytes(base.resolve(name));
    }
}
