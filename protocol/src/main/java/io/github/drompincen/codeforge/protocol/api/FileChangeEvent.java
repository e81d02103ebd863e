package io.github.drompincen.codeforge.protocol.api;

/**
 * Side-effect notification for a file mutation. Content fields are null when not applicable,
 * e.g. {@code oldContent} for a created file.
 */
public record FileChangeEvent(
        String path,
        FileChangeType changeType,
        String oldContent,
        String newContent
) {
    public static FileChangeEvent created(String path, String content) {
        return new FileChangeEvent(path, FileChangeType.CREATED, null, content);
    }

    public static FileChangeEvent modified(String path, String oldContent, String newContent) {
        return new FileChangeEvent(path, FileChangeType.MODIFIED, oldContent, newContent);
    }

    public static FileChangeEvent deleted(String path, String oldContent) {
        return new FileChangeEvent(path, FileChangeType.DELETED, oldContent, null);
    }
}
