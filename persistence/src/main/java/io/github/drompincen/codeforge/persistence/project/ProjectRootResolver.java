package io.github.drompincen.codeforge.persistence.project;

import java.nio.file.Path;

@FunctionalInterface
public interface ProjectRootResolver {

    Path resolve(String projectId);

    static ProjectRootResolver under(Path baseDirectory) {
        Path base = baseDirectory.toAbsolutePath().normalize();
        return projectId -> base.resolve(projectId).normalize();
    }
}
