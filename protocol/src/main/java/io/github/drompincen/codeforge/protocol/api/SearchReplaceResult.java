package io.github.drompincen.codeforge.protocol.api;

import java.util.List;

/**
 * Outcome of a project-wide replace. {@code files} lists the files that were (or, on a dry run,
 * would be) rewritten; {@code failures} the matching files that could not be written.
 */
public record SearchReplaceResult(
        int filesModified,
        int totalReplacements,
        List<FileReplacement> files,
        List<FileFailure> failures
) {
    public record FileReplacement(String path, int count) {}

    public record FileFailure(String path, String reason) {}

    public SearchReplaceResult {
        files = files != null ? List.copyOf(files) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public SearchReplaceResult(int filesModified, int totalReplacements, List<FileReplacement> files) {
        this(filesModified, totalReplacements, files, List.of());
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
