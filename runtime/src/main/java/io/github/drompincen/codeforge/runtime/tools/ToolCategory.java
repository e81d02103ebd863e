package io.github.drompincen.codeforge.runtime.tools;

public enum ToolCategory {
    FILE,
    SEARCH,
    MEMORY,
    TODO,
    AGENT_CONTROL
}
