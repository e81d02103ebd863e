package io.github.drompincen.codeforge.protocol.api;

import java.util.List;

public record FileTreeNode(
        String name,
        String path,
        int depth,
        boolean folder,
        String extension,
        long size,
        List<FileTreeNode> children
) {
    public FileTreeNode {
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static FileTreeNode file(String name, String path, int depth, long size) {
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot + 1) : "";
        return new FileTreeNode(name, path, depth, false, extension, size, List.of());
    }

    public static FileTreeNode folder(String name, String path, int depth, List<FileTreeNode> children) {
        return new FileTreeNode(name, path, depth, true, null, 0, children);
    }
}
