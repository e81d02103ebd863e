package io.github.drompincen.codeforge.protocol.content;

/**
 * A semantically distinct unit of a rendered assistant message. Block order matches the text order.
 */
public interface ContentBlock {

    record ReasoningBlock(String text, boolean active) implements ContentBlock {}

    record ToolCallBlock(
            String name,
            ToolStatus status,
            String output,
            String filePath,
            DiffStats diffStats
    ) implements ContentBlock {
        public ToolCallBlock(String name, ToolStatus status, String output) {
            this(name, status, output, null, null);
        }
    }

    record TextBlock(String text) implements ContentBlock {}

    record CodeBlock(String code, String language) implements ContentBlock {}
}
