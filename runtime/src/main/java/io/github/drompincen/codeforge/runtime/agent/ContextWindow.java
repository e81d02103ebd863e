package io.github.drompincen.codeforge.runtime.agent;

import io.github.drompincen.codeforge.protocol.api.ChatMessage;
import io.github.drompincen.codeforge.protocol.api.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a request within a token budget before it goes to the provider.
 * <p>
 * Tool outputs longer than the configured limit are cut down first. If the request is
 * still over budget, the oldest turns are dropped. An assistant message that calls tools
 * is dropped together with its tool results. The system message, the latest user
 * message and the most recent turn always stay.
 */
public class ContextWindow {

    private static final Logger log = LoggerFactory.getLogger(ContextWindow.class);

    static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private final int budgetTokens;
    private final int maxToolOutputChars;

    public ContextWindow(int budgetTokens, int maxToolOutputChars) {
        this.budgetTokens = budgetTokens;
        this.maxToolOutputChars = maxToolOutputChars;
    }

    public static ContextWindow from(AgentProperties properties) {
        return new ContextWindow(properties.contextBudgetTokens(), properties.maxToolOutputChars());
    }

    public List<ChatMessage> fit(String systemPrompt, List<ChatMessage> conversation) {
        ChatMessage system = ChatMessage.system(systemPrompt);
        List<List<ChatMessage>> turns = group(conversation);
        int total = estimateTokens(system);
        for (List<ChatMessage> turn : turns) {
            total += estimateTokens(turn);
        }

        int pinned = lastUserTurn(turns);
        int dropped = 0;
        int index = 0;
        while (total > budgetTokens && index < turns.size() - 1) {
            if (index == pinned) {
                index++;
                continue;
            }
            total -= estimateTokens(turns.remove(index));
            dropped++;
            if (pinned > index) {
                pinned--;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} old turn(s) to fit the context budget of {} tokens", dropped, budgetTokens);
        }
        if (total > budgetTokens) {
            log.warn("Request still needs about {} tokens after pruning, over the budget of {}", total, budgetTokens);
        }

        List<ChatMessage> request = new ArrayList<>();
        request.add(system);
        turns.forEach(request::addAll);
        return request;
    }

    public static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }

    static int estimateTokens(ChatMessage message) {
        int tokens = MESSAGE_OVERHEAD_TOKENS + estimateTokens(message.content());
        if (message.toolCalls() != null) {
            for (ToolCall call : message.toolCalls()) {
                if (call.function() != null) {
                    tokens += estimateTokens(call.function().name()) + estimateTokens(call.function().arguments());
                }
            }
        }
        return tokens;
    }

    private static int estimateTokens(List<ChatMessage> turn) {
        int tokens = 0;
        for (ChatMessage message : turn) {
            tokens += estimateTokens(message);
        }
        return tokens;
    }

    private List<List<ChatMessage>> group(List<ChatMessage> conversation) {
        List<List<ChatMessage>> turns = new ArrayList<>();
        for (ChatMessage message : conversation) {
            ChatMessage fitted = truncateToolOutput(message);
            if (ChatMessage.TOOL.equals(fitted.role()) && !turns.isEmpty()) {
                turns.get(turns.size() - 1).add(fitted);
            } else {
                List<ChatMessage> turn = new ArrayList<>();
                turn.add(fitted);
                turns.add(turn);
            }
        }
        return turns;
    }

    private static int lastUserTurn(List<List<ChatMessage>> turns) {
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (ChatMessage.USER.equals(turns.get(i).get(0).role())) {
                return i;
            }
        }
        return -1;
    }

    ChatMessage truncateToolOutput(ChatMessage message) {
        String content = message.content();
        if (!ChatMessage.TOOL.equals(message.role()) || content == null || content.length() <= maxToolOutputChars) {
            return message;
        }
        String cut = content.substring(0, maxToolOutputChars)
                + "\n... [truncated " + (content.length() - maxToolOutputChars) + " characters]";
        return new ChatMessage(message.role(), cut, message.toolCalls(), message.toolCallId(), message.name());
    }
}
