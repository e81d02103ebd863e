package io.github.drompincen.codeforge.runtime.tools;

/**
 * A tool call argument is missing or has the wrong shape. Reported to the model as a failed result.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }

    public static ToolArgumentException missing(String name) {
        return new ToolArgumentException("Missing required argument: " + name);
    }

    public static ToolArgumentException invalid(String name, String expected) {
        return new ToolArgumentException("Invalid argument '" + name + "': expected " + expected);
    }
}
