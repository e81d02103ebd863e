package io.github.drompincen.codeforge.persistence.project;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Glob matcher for project-relative paths. A pattern without {@code /} is matched against
 * the file name only. Matching ignores case. Malformed patterns degrade to substring containment.
 */
public final class GlobPattern {

    private static final Logger log = LoggerFactory.getLogger(GlobPattern.class);

    private final String glob;
    private final Pattern regex;
    private final String literal;
    private final boolean matchPath;

    private GlobPattern(String glob, Pattern regex, String literal) {
        this.glob = glob;
        this.regex = regex;
        this.literal = literal;
        this.matchPath = glob.contains("/");
    }

    public static GlobPattern compile(String glob) {
        String trimmed = glob == null ? "" : glob.trim();
        try {
            return new GlobPattern(trimmed, Pattern.compile(toRegex(trimmed), Pattern.CASE_INSENSITIVE), null);
        } catch (PatternSyntaxException e) {
            log.debug("Glob '{}' is not a valid pattern, falling back to substring match: {}",
                    trimmed, e.getDescription());
            return new GlobPattern(trimmed, null, trimmed.replace("*", "").toLowerCase(Locale.ROOT));
        }
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                    sb.append("(?:.*/)?");
                    i += 3;
                } else {
                    sb.append(".*");
                    i += 2;
                }
                continue;
            }
            if (c == '*') {
                sb.append("[^/]*");
            } else if (c == '.') {
                sb.append("\\.");
            } else {
                sb.append(c);
            }
            i++;
        }
        return sb.toString();
    }

    public boolean matches(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        String target = matchPath ? normalized : fileName(normalized);
        if (regex != null) {
            return regex.matcher(target).matches();
        }
        return target.toLowerCase(Locale.ROOT).contains(literal);
    }

    public boolean isFallback() {
        return regex == null;
    }

    public String glob() {
        return glob;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
