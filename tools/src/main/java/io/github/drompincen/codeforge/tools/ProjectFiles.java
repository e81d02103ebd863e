package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.protocol.api.FileTreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers over the project file tree shared by the file and search tools.
 */
final class ProjectFiles {

    static final String FOLDER_ICON = "📁";
    static final String FILE_ICON = "📄";

    private ProjectFiles() {}

    /** Project-relative path with separators normalized and no leading or trailing slash. */
    static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p.equals(".") ? "" : p;
    }

    static Optional<FileTreeNode> find(List<FileTreeNode> nodes, String path) {
        String target = normalize(path);
        for (FileTreeNode node : nodes) {
            if (node.path().equals(target)) {
                return Optional.of(node);
            }
            if (node.folder() && target.startsWith(node.path() + "/")) {
                return find(node.children(), target);
            }
        }
        return Optional.empty();
    }

    /** All files below the given nodes, depth first in tree order. */
    static List<FileTreeNode> files(List<FileTreeNode> nodes) {
        List<FileTreeNode> out = new ArrayList<>();
        collect(nodes, out);
        return out;
    }

    private static void collect(List<FileTreeNode> nodes, List<FileTreeNode> out) {
        for (FileTreeNode node : nodes) {
            if (node.folder()) {
                collect(node.children(), out);
            } else {
                out.add(node);
            }
        }
    }

    static int countFolders(List<FileTreeNode> nodes) {
        int count = 0;
        for (FileTreeNode node : nodes) {
            if (node.folder()) {
                count += 1 + countFolders(node.children());
            }
        }
        return count;
    }

    static String render(List<FileTreeNode> nodes) {
        StringBuilder sb = new StringBuilder();
        render(nodes, "", sb);
        return sb.toString().stripTrailing();
    }

    private static void render(List<FileTreeNode> nodes, String indent, StringBuilder sb) {
        for (FileTreeNode node : nodes) {
            if (node.folder()) {
                sb.append(indent).append(FOLDER_ICON).append(' ').append(node.name()).append("/\n");
                render(node.children(), indent + "  ", sb);
            } else {
                sb.append(indent).append(FILE_ICON).append(' ').append(node.name()).append('\n');
            }
        }
    }

    /** Path relative to {@code base}; {@code base} is a normalized folder path, empty for the root. */
    static String relativeTo(String base, String path) {
        return base.isEmpty() ? path : path.substring(base.length() + 1);
    }

    static List<String> lines(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(List.of(content.split("\\r?\\n", -1)));
        if (content.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
