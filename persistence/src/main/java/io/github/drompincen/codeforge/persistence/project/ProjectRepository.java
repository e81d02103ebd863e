package io.github.drompincen.codeforge.persistence.project;

import io.github.drompincen.codeforge.protocol.api.FileTreeNode;
import io.github.drompincen.codeforge.protocol.api.SearchReplaceResult;

import java.util.List;

/**
 * File operations on a project's sandboxed file tree. Paths are relative to the project root
 * and use {@code /} separators. Implementations report failures through {@link RepositoryResult}
 * and never throw.
 */
public interface ProjectRepository {

    RepositoryResult<String> readFile(String projectId, String path);

    /** Writes content, replacing any existing file and creating parent folders. */
    RepositoryResult<Void> writeFile(String projectId, String path, String content);

    /** Fails when the file already exists. */
    RepositoryResult<Void> createFile(String projectId, String path, String content);

    /** Deletes a file or, recursively, a folder. */
    RepositoryResult<Void> deleteFile(String projectId, String path);

    RepositoryResult<Void> renameFile(String projectId, String oldPath, String newPath);

    RepositoryResult<Void> copyFile(String projectId, String sourcePath, String destinationPath);

    RepositoryResult<Void> moveFile(String projectId, String sourcePath, String destinationPath);

    RepositoryResult<Void> createFolder(String projectId, String path);

    RepositoryResult<List<FileTreeNode>> getFileTree(String projectId);

    RepositoryResult<SearchReplaceResult> searchAndReplace(String projectId, String search, String replace,
                                                           String filePattern, boolean dryRun);

    /** Replaces every occurrence of {@code oldContent}; fails when it does not occur in the file. */
    RepositoryResult<Void> patchFile(String projectId, String path, String oldContent, String newContent);
}
