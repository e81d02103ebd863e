package io.github.drompincen.codeforge.protocol.content;

public enum ToolStatus {
    RUNNING,
    SUCCESS,
    ERROR
}
