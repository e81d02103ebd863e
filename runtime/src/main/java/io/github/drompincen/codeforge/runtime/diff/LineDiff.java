package io.github.drompincen.codeforge.runtime.diff;

import io.github.drompincen.codeforge.protocol.content.DiffStats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Positional line comparison: line {@code i} of one text is compared with line {@code i} of the
 * other. Cheap and predictable, but an inserted line shows every following line as changed.
 */
public final class LineDiff {

    public static final int MAX_DIFFERENCES = 50;

    private LineDiff() {}

    public record Difference(int line, String before, String after) {

        public boolean isAddition() {
            return before == null;
        }

        public boolean isDeletion() {
            return after == null;
        }
    }

    public record Result(List<Difference> differences, int total) {

        public boolean truncated() {
            return total > differences.size();
        }
    }

    public static Result compare(String before, String after) {
        return compare(before, after, MAX_DIFFERENCES);
    }

    public static Result compare(String before, String after, int limit) {
        String[] a = lines(before);
        String[] b = lines(after);
        List<Difference> differences = new ArrayList<>();
        int total = 0;
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String left = i < a.length ? a[i] : null;
            String right = i < b.length ? b[i] : null;
            if (left != null && left.equals(right)) {
                continue;
            }
            total++;
            if (differences.size() < limit) {
                differences.add(new Difference(i + 1, left, right));
            }
        }
        return new Result(List.copyOf(differences), total);
    }

    /** Changed lines count as one addition and one deletion. */
    public static DiffStats stats(String before, String after) {
        String[] a = lines(before);
        String[] b = lines(after);
        int additions = 0;
        int deletions = 0;
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String left = i < a.length ? a[i] : null;
            String right = i < b.length ? b[i] : null;
            if (left != null && left.equals(right)) {
                continue;
            }
            if (right != null) {
                additions++;
            }
            if (left != null) {
                deletions++;
            }
        }
        return new DiffStats(additions, deletions);
    }

    /** A single final line break ends the last line; any further blank lines are kept. */
    static String[] lines(String text) {
        if (text == null || text.isEmpty()) {
            return new String[0];
        }
        String[] lines = text.split("\\r?\\n", -1);
        if (lines[lines.length - 1].isEmpty()) {
            return Arrays.copyOf(lines, lines.length - 1);
        }
        return lines;
    }
}
