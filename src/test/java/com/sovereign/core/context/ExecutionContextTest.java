package com.sovereign.core.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionContextTest {

    private final ExecutionContext root =
            ExecutionContext.root("deploy_20241225_093000", ExecutionMode.ARCHITECT, Map.of("repo_path", "/tmp/repo"));

    @Nested
    @DisplayName("deriveChild")
    class DeriveChildTests {

        @Test
        @DisplayName("keeps trace and mode, extends span, records parent span")
        void childInvariants() {
            var child = root.deriveChild("repo_prep");

            assertEquals(root.traceId(), child.traceId());
            assertEquals(root.mode(), child.mode());
            assertEquals("root.repo_prep", child.spanId());
            assertEquals("root", child.metadata().get(ExecutionContext.PARENT_SPAN_KEY));
            assertEquals("/tmp/repo", child.metadata().get("repo_path"));
        }

        @Test
        @DisplayName("grandchild span reflects the full ancestry")
        void grandchild() {
            var grandchild = root.deriveChild("repo_prep").deriveChild("git_init");

            assertEquals("root.repo_prep.git_init", grandchild.spanId());
            assertEquals("root.repo_prep", grandchild.metadata().get(ExecutionContext.PARENT_SPAN_KEY));
        }

        @Test
        @DisplayName("leaves the parent untouched")
        void parentUnchanged() {
            root.deriveChild("commit");

            assertEquals("root", root.spanId());
            assertFalse(root.metadata().containsKey(ExecutionContext.PARENT_SPAN_KEY));
        }

        @Test
        @DisplayName("is deterministic for the same name")
        void deterministic() {
            assertEquals(root.deriveChild("commit"), root.deriveChild("commit"));
        }

        @Test
        @DisplayName("rejects blank operation names")
        void rejectsBlank() {
            assertThrows(IllegalArgumentException.class, () -> root.deriveChild(" "));
            assertThrows(IllegalArgumentException.class, () -> root.deriveChild(null));
        }
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("root context uses the root span")
        void rootSpan() {
            assertEquals(ExecutionContext.ROOT_SPAN, root.spanId());
        }

        @Test
        @DisplayName("metadata is copied and unmodifiable")
        void metadataCopied() {
            var source = new HashMap<String, String>();
            source.put("k", "v");
            var context = ExecutionContext.root("t", ExecutionMode.STUDENT, source);
            source.put("k", "changed");

            assertEquals("v", context.metadata().get("k"));
            assertThrows(UnsupportedOperationException.class, () -> context.metadata().put("x", "y"));
        }

        @Test
        @DisplayName("withMetadata returns a copy with one more entry")
        void withMetadata() {
            var extended = root.withMetadata("remote_url", "https://example.com/r.git");

            assertEquals("https://example.com/r.git", extended.metadata().get("remote_url"));
            assertFalse(root.metadata().containsKey("remote_url"));
            assertEquals(root.spanId(), extended.spanId());
        }

        @Test
        @DisplayName("newTraceId has the prefix_yyyyMMdd_HHmmss format")
        void traceIdFormat() {
            assertTrue(ExecutionContext.newTraceId("deploy").matches("deploy_\\d{8}_\\d{6}"));
        }
    }

    @Test
    @DisplayName("displayName capitalizes the mode")
    void displayName() {
        assertEquals("Firefighter", ExecutionMode.FIREFIGHTER.displayName());
    }
}
