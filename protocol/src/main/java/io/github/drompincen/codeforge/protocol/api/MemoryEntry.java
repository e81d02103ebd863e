package io.github.drompincen.codeforge.protocol.api;

public record MemoryEntry(String projectId, String key, String value) {}
