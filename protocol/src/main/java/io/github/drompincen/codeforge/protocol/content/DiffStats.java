package io.github.drompincen.codeforge.protocol.content;

public record DiffStats(int additions, int deletions) {

    public String format() {
        return "(+" + additions + " -" + deletions + ")";
    }
}
