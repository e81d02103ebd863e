package io.github.drompincen.codeforge.protocol.api;

public enum FileChangeType {
    CREATED,
    MODIFIED,
    DELETED,
    RENAMED,
    COPIED,
    MOVED
}
