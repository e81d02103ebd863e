package io.github.drompincen.codeforge.persistence.project;

import java.util.function.Function;

/**
 * Outcome of a {@link ProjectRepository} operation: either a value or an error message, never both.
 */
public record RepositoryResult<T>(T value, String error) {

    public static <T> RepositoryResult<T> success(T value) {
        return new RepositoryResult<>(value, null);
    }

    public static RepositoryResult<Void> success() {
        return new RepositoryResult<>(null, null);
    }

    public static <T> RepositoryResult<T> failure(String error) {
        return new RepositoryResult<>(null, error != null ? error : "Unknown error");
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <U> RepositoryResult<U> map(Function<? super T, ? extends U> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }
}
