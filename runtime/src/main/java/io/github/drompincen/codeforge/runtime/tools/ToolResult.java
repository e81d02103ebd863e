package io.github.drompincen.codeforge.runtime.tools;

public record ToolResult(
        boolean success,
        String output,
        String error
) {
    public static ToolResult success(String output) {
        return new ToolResult(true, output != null ? output : "", null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, "", error);
    }

    /** Text reported back to the model as the tool message content. */
    public String toModelContent() {
        return success ? output : "Error: " + error;
    }
}
