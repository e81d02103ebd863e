package io.github.drompincen.codeforge.persistence.project;

import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.protocol.api.SearchReplaceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * {@link ProjectRepository} over the local file system. Every project lives in its own folder and
 * paths that escape it are rejected.
 */
@Service
public class FileSystemProjectRepository implements ProjectRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemProjectRepository.class);

    private final ProjectRootResolver roots;

    @Autowired
    public FileSystemProjectRepository(
            @Value("${codeforge.projects.directory:${user.home}/.codeforge/projects}") String directory) {
        this(ProjectRootResolver.under(Path.of(directory)));
    }

    public FileSystemProjectRepository(ProjectRootResolver roots) {
        this.roots = roots;
    }

    @Override
    public RepositoryResult<String> readFile(String projectId, String path) {
        try {
            Path file = resolve(projectId, path);
            if (!Files.isRegularFile(file)) {
                return RepositoryResult.failure("File not found: " + path);
            }
            return RepositoryResult.success(Files.readString(file));
        } catch (IOException | InvalidPathException e) {
            return failure("read", path, e);
        }
    }

    @Override
    public RepositoryResult<Void> writeFile(String projectId, String path, String content) {
        try {
            Path file = resolve(projectId, path);
            if (Files.isDirectory(file)) {
                return RepositoryResult.failure("Path is a folder: " + path);
            }
            createParents(file);
            Files.writeString(file, content);
            return RepositoryResult.success();
        } catch (IOException | InvalidPathException e) {
            return failure("write", path, e);
        }
    }

    @Override
    public RepositoryResult<Void> createFile(String projectId, String path, String content) {
        try {
            Path file = resolve(projectId, path);
            if (Files.exists(file)) {
                return RepositoryResult.failure("File already exists: " + path);
            }
            createParents(file);
            Files.writeString(file, content);
            return RepositoryResult.success();
        } catch (FileAlreadyExistsException e) {
            return RepositoryResult.failure("File already exists: " + path);
        } catch (IOException | InvalidPathException e) {
            return failure("create", path, e);
        }
    }

    @Override
    public RepositoryResult<Void> deleteFile(String projectId, String path) {
        try {
            Path target = resolve(projectId, path);
            if (target.equals(roots.resolve(projectId))) {
                return RepositoryResult.failure("Cannot delete the project root");
            }
            if (!Files.exists(target)) {
                return RepositoryResult.failure("File not found: " + path);
            }
            deleteRecursively(target);
            return RepositoryResult.success();
        } catch (IOException | UncheckedIOException | InvalidPathException e) {
            return failure("delete", path, e);
        }
    }

    @Override
    public RepositoryResult<Void> renameFile(String projectId, String oldPath, String newPath) {
        return relocate(projectId, oldPath, newPath, false);
    }

    @Override
    public RepositoryResult<Void> copyFile(String projectId, String sourcePath, String destinationPath) {
        try {
            Path source = resolve(projectId, sourcePath);
            Path destination = resolve(projectId, destinationPath);
            if (!Files.exists(source)) {
                return RepositoryResult.failure("Source not found: " + sourcePath);
            }
            if (Files.exists(destination)) {
                return RepositoryResult.failure("Destination already exists: " + destinationPath);
            }
            createParents(destination);
            if (Files.isDirectory(source)) {
                copyRecursively(source, destination);
            } else {
                Files.copy(source, destination);
            }
            return RepositoryResult.success();
        } catch (IOException | UncheckedIOException | InvalidPathException e) {
            return failure("copy", sourcePath, e);
        }
    }

    @Override
    public RepositoryResult<Void> moveFile(String projectId, String sourcePath, String destinationPath) {
        return relocate(projectId, sourcePath, destinationPath, true);
    }

    @Override
    public RepositoryResult<Void> createFolder(String projectId, String path) {
        try {
            Path folder = resolve(projectId, path);
            if (Files.exists(folder)) {
                return RepositoryResult.failure("Folder already exists: " + path);
            }
            Files.createDirectories(folder);
            return RepositoryResult.success();
        } catch (IOException | InvalidPathException e) {
            return failure("create folder", path, e);
        }
    }

    @Override
    public RepositoryResult<List<FileTreeNode>> getFileTree(String projectId) {
        try {
            Path root = roots.resolve(projectId);
            if (!Files.isDirectory(root)) {
                return RepositoryResult.success(List.of());
            }
            return RepositoryResult.success(children(root, root, 0));
        } catch (IOException | UncheckedIOException | InvalidPathException e) {
            return failure("list", projectId, e);
        }
    }

    @Override
    public RepositoryResult<SearchReplaceResult> searchAndReplace(String projectId, String search, String replace,
                                                                  String filePattern, boolean dryRun) {
        if (search == null || search.isEmpty()) {
            return RepositoryResult.failure("Search text must not be empty");
        }
        Path root = roots.resolve(projectId);
        if (!Files.isDirectory(root)) {
            return RepositoryResult.success(new SearchReplaceResult(0, 0, List.of()));
        }
        GlobPattern glob = filePattern == null || filePattern.isBlank() ? null : GlobPattern.compile(filePattern);
        List<SearchReplaceResult.FileReplacement> replacements = new ArrayList<>();
        List<SearchReplaceResult.FileFailure> failures = new ArrayList<>();
        int total = 0;
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk.filter(Files::isRegularFile)
                    .filter(p -> !isHidden(root, p))
                    .sorted()
                    .toList();
            for (Path file : files) {
                String relative = relativize(root, file);
                if (glob != null && !glob.matches(relative)) {
                    continue;
                }
                String content;
                try {
                    content = Files.readString(file);
                } catch (IOException e) {
                    log.debug("Skipping unreadable file {}: {}", relative, e.getMessage());
                    continue;
                }
                int count = countOccurrences(content, search);
                if (count == 0) {
                    continue;
                }
                if (!dryRun) {
                    try {
                        rewrite(file, content.replace(search, replace != null ? replace : ""));
                    } catch (IOException e) {
                        log.warn("Could not rewrite {} during search and replace: {}", relative, e.getMessage());
                        failures.add(new SearchReplaceResult.FileFailure(relative, describe(e)));
                        continue;
                    }
                }
                replacements.add(new SearchReplaceResult.FileReplacement(relative, count));
                total += count;
            }
        } catch (IOException | UncheckedIOException e) {
            return failure("search", projectId, e);
        }
        log.debug("search_replace in {} matched {} occurrences across {} files (dryRun={}, failed={})",
                projectId, total, replacements.size(), dryRun, failures.size());
        return RepositoryResult.success(
                new SearchReplaceResult(replacements.size(), total, replacements, failures));
    }

    @Override
    public RepositoryResult<Void> patchFile(String projectId, String path, String oldContent, String newContent) {
        RepositoryResult<String> current = readFile(projectId, path);
        if (current.isFailure()) {
            return RepositoryResult.failure(current.error());
        }
        if (oldContent == null || oldContent.isEmpty() || !current.value().contains(oldContent)) {
            return RepositoryResult.failure("Content to replace not found in " + path);
        }
        return writeFile(projectId, path, current.value().replace(oldContent, newContent));
    }

    void rewrite(Path file, String content) throws IOException {
        Files.writeString(file, content);
    }

    Path resolve(String projectId, String path) throws IOException {
        Path root = roots.resolve(projectId);
        String relative = path == null ? "" : path.trim().replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Path is outside the project: " + path);
        }
        return resolved;
    }

    private RepositoryResult<Void> relocate(String projectId, String sourcePath, String destinationPath,
                                            boolean createParents) {
        try {
            Path source = resolve(projectId, sourcePath);
            Path destination = resolve(projectId, destinationPath);
            if (!Files.exists(source)) {
                return RepositoryResult.failure("Source not found: " + sourcePath);
            }
            if (Files.exists(destination)) {
                return RepositoryResult.failure("Destination already exists: " + destinationPath);
            }
            if (createParents) {
                createParents(destination);
            } else if (destination.getParent() != null && !Files.isDirectory(destination.getParent())) {
                return RepositoryResult.failure("Parent folder does not exist: " + destinationPath);
            }
            Files.move(source, destination);
            return RepositoryResult.success();
        } catch (IOException | InvalidPathException e) {
            return failure(createParents ? "move" : "rename", sourcePath, e);
        }
    }

    private List<FileTreeNode> children(Path root, Path folder, int depth) throws IOException {
        List<Path> entries;
        try (Stream<Path> list = Files.list(folder)) {
            entries = list.filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)))
                    .toList();
        }
        List<FileTreeNode> nodes = new ArrayList<>();
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            String relative = relativize(root, entry);
            if (Files.isDirectory(entry)) {
                nodes.add(FileTreeNode.folder(name, relative, depth, children(root, entry, depth + 1)));
            } else {
                nodes.add(FileTreeNode.file(name, relative, depth, Files.size(entry)));
            }
        }
        return nodes;
    }

    private static boolean isHidden(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static int countOccurrences(String content, String search) {
        int count = 0;
        int from = 0;
        while ((from = content.indexOf(search, from)) >= 0) {
            count++;
            from += search.length();
        }
        return count;
    }

    private static void createParents(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void deleteRecursively(Path target) throws IOException {
        if (!Files.isDirectory(target)) {
            Files.delete(target);
            return;
        }
        try (Stream<Path> walk = Files.walk(target)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static void copyRecursively(Path source, Path destination) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path p : walk.toList()) {
                Path target = destination.resolve(source.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(target);
                } else {
                    Files.copy(p, target);
                }
            }
        }
    }

    private static <T> RepositoryResult<T> failure(String operation, String path, Exception e) {
        log.debug("Failed to {} {}: {}", operation, path, e.getMessage());
        String message = e instanceof NoSuchFileException ? "File not found: " + path : describe(e);
        return RepositoryResult.failure(message);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
