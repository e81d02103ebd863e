package io.github.drompincen.codeforge.runtime.content;

import io.github.drompincen.codeforge.protocol.content.ContentBlock;
import io.github.drompincen.codeforge.protocol.content.DiffStats;
import io.github.drompincen.codeforge.protocol.content.ToolStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits assistant text into ordered {@link ContentBlock}s.
 * <p>
 * Tool activity is written into the transcript as a status marker preceded by a blank line:
 * <pre>
 * \n\n🔧 **write_file**
 * ✅ File updated successfully: index.html (+3 -1)
 * </pre>
 * Text between markers may contain {@code <thinking>}-style reasoning tags and fenced code.
 * While streaming, an unclosed reasoning tag in the last segment renders as active reasoning.
 */
@Component
public class ContentSegmenter {

    public static final String TOOL_MARKER = "🔧";
    public static final String SUCCESS_GLYPH = "✅";
    public static final String ERROR_GLYPH = "❌";
    public static final String RUNNING_GLYPH = "⏳";
    static final String BOUNDARY = "\n\n" + TOOL_MARKER;

    private static final String TAGS = "thinking|think|reasoning|thought";
    private static final Pattern CLOSED_REASONING = Pattern.compile(
            "<(" + TAGS + ")\\s*>(.*?)</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern OPEN_REASONING = Pattern.compile(
            "<(" + TAGS + ")\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_FENCE = Pattern.compile(
            "```([\\w+#.-]*)[ \\t]*\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern TOOL_HEADER = Pattern.compile(
            "^" + TOOL_MARKER + "\\s*\\*\\*([^*\\n]+)\\*\\*[^\\n]*(?:\\n|$)");
    private static final Pattern FILE_PATH = Pattern.compile("([a-zA-Z0-9_\\-./]+\\.[a-zA-Z0-9]+)");
    private static final Pattern DIFF_STATS = Pattern.compile("\\(\\+(\\d{1,9}) -(\\d{1,9})\\)");
    private static final Set<String> FILE_TOOLS = Set.of(
            "write_file", "patch_file", "insert_at_line", "append_to_file", "delete_file",
            "rename_file", "copy_file", "move_file", "create_folder");

    public List<ContentBlock> parse(String fullText, boolean streaming) {
        if (fullText == null || fullText.isBlank()) {
            return List.of();
        }
        List<ContentBlock> blocks = new ArrayList<>();
        int start = 0;
        int boundary;
        while ((boundary = fullText.indexOf(BOUNDARY, start)) >= 0) {
            blocks.addAll(parseSegment(fullText.substring(start, boundary), false));
            start = boundary + 2;
        }
        blocks.addAll(parseSegment(fullText.substring(start), streaming));
        return complete(blocks, fullText);
    }

    /** Parses one segment: either a tool status segment or plain text. */
    List<ContentBlock> parseSegment(String segment, boolean streaming) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (segment.startsWith(TOOL_MARKER)) {
            parseTool(segment, streaming, blocks);
        } else {
            parseText(segment, streaming, blocks);
        }
        return blocks;
    }

    static List<ContentBlock> complete(List<ContentBlock> blocks, String fullText) {
        if (blocks.isEmpty() && !fullText.isBlank()) {
            return List.of(new ContentBlock.TextBlock(fullText.trim()));
        }
        return List.copyOf(blocks);
    }

    private void parseTool(String segment, boolean streaming, List<ContentBlock> out) {
        Matcher header = TOOL_HEADER.matcher(segment);
        if (!header.find()) {
            parseText(segment, streaming, out);
            return;
        }
        String name = header.group(1).trim();
        String body = segment.substring(header.end());

        ToolStatus status = ToolStatus.RUNNING;
        if (body.startsWith(SUCCESS_GLYPH)) {
            status = ToolStatus.SUCCESS;
            body = body.substring(SUCCESS_GLYPH.length());
        } else if (body.startsWith(ERROR_GLYPH)) {
            status = ToolStatus.ERROR;
            body = body.substring(ERROR_GLYPH.length());
        } else if (body.startsWith(RUNNING_GLYPH)) {
            body = body.substring(RUNNING_GLYPH.length());
        }

        int end = outputEnd(body);
        String output = body.substring(0, end).trim();
        String trailing = end < body.length() ? body.substring(end) : "";

        out.add(new ContentBlock.ToolCallBlock(name, status, output.isEmpty() ? null : output,
                filePath(name, output), diffStats(name, output)));
        if (!trailing.isBlank()) {
            parseText(trailing, streaming, out);
        }
    }

    /** Tool output runs until a blank line that is followed by prose. */
    private static int outputEnd(String body) {
        int from = 0;
        int gap;
        while ((gap = body.indexOf("\n\n", from)) >= 0) {
            String next = body.substring(gap + 2);
            if (!next.startsWith(SUCCESS_GLYPH) && !next.startsWith(ERROR_GLYPH)) {
                return gap;
            }
            from = gap + 2;
        }
        return body.length();
    }

    private void parseText(String text, boolean streaming, List<ContentBlock> out) {
        Matcher closed = CLOSED_REASONING.matcher(text);
        int pos = 0;
        while (closed.find()) {
            addText(text.substring(pos, closed.start()), out);
            String reasoning = closed.group(2).trim();
            if (!reasoning.isEmpty()) {
                out.add(new ContentBlock.ReasoningBlock(reasoning, false));
            }
            pos = closed.end();
        }
        String rest = text.substring(pos);
        if (streaming) {
            Matcher open = OPEN_REASONING.matcher(rest);
            if (open.find()) {
                addText(rest.substring(0, open.start()), out);
                out.add(new ContentBlock.ReasoningBlock(rest.substring(open.end()).trim(), true));
                return;
            }
        }
        addText(rest, out);
    }

    private static void addText(String text, List<ContentBlock> out) {
        Matcher fence = CODE_FENCE.matcher(text);
        int pos = 0;
        while (fence.find()) {
            addPlain(text.substring(pos, fence.start()), out);
            String language = fence.group(1).isEmpty() ? null : fence.group(1);
            String code = fence.group(2);
            if (code.endsWith("\n")) {
                code = code.substring(0, code.length() - 1);
            }
            out.add(new ContentBlock.CodeBlock(code, language));
            pos = fence.end();
        }
        addPlain(text.substring(pos), out);
    }

    private static void addPlain(String text, List<ContentBlock> out) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            out.add(new ContentBlock.TextBlock(trimmed));
        }
    }

    private static String filePath(String toolName, String output) {
        if (!FILE_TOOLS.contains(toolName) || output.isEmpty()) {
            return null;
        }
        int newline = output.indexOf('\n');
        String firstLine = newline >= 0 ? output.substring(0, newline) : output;
        Matcher m = FILE_PATH.matcher(firstLine);
        String last = null;
        while (m.find()) {
            last = m.group(1);
        }
        return last;
    }

    private static DiffStats diffStats(String toolName, String output) {
        if (!FILE_TOOLS.contains(toolName)) {
            return null;
        }
        Matcher m = DIFF_STATS.matcher(output);
        if (!m.find()) {
            return null;
        }
        return new DiffStats(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
}
