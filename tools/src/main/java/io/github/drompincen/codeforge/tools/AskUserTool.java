package io.github.drompincen.codeforge.tools;

import io.github.drompincen.codeforge.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Asks the user a question through the interaction callback, blocking until answered. Without an
 * interactive callback the question itself is returned so the model can relay it in its reply.
 */
public class AskUserTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(AskUserTool.class);

    @Override public String name() { return "ask_user"; }
    @Override public String description() {
        return "Ask the user a question when clarification is needed before continuing";
    }

    @Override public JsonNode inputSchema() {
        return ToolSchema.object()
                .string("question", "Question to ask", true)
                .string("options", "Optional comma-separated list of suggested answers", false)
                .build();
    }

    @Override public ToolCategory category() { return ToolCategory.AGENT_CONTROL; }

    @Override
    public ToolResult execute(ToolContext ctx, ToolArguments args) {
        String question = args.requireString("question");
        List<String> options = args.optionalList("options");

        if (!ctx.callback().canAskUser()) {
            StringBuilder sb = new StringBuilder(question);
            if (!options.isEmpty()) {
                sb.append("\nOptions: ").append(String.join(", ", options));
            }
            return ToolResult.success(sb.toString());
        }
        log.debug("Asking user for project {}: {}", ctx.projectId(), question);
        Optional<String> answer = ctx.callback().askUser(question, options);
        return ToolResult.success(answer.map(a -> "User answered: " + a)
                .orElse("The user did not answer"));
    }
}
