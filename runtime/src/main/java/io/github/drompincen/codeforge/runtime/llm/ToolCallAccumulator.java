package io.github.drompincen.codeforge.runtime.llm;

import io.github.drompincen.codeforge.protocol.api.ToolCallDelta;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reassembles index-keyed tool call fragments. Each index is one slot that accumulates until
 * {@link #finalizeOpenSlots()} snapshots it; a finalized index never reopens. Arguments are
 * concatenated as received and not validated here.
 * <p>
 * Not thread-safe: one accumulator belongs to one stream.
 */
public class ToolCallAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallAccumulator.class);

    private final Map<Integer, Slot> open = new TreeMap<>();
    private final Set<Integer> finalized = new HashSet<>();

    public void accept(ToolCallDelta delta) {
        int index = delta.slot();
        if (finalized.contains(index)) {
            log.warn("Ignoring tool call fragment for already finalized index {}", index);
            return;
        }
        Slot slot = open.computeIfAbsent(index, Slot::new);
        if (delta.id() != null && !delta.id().isEmpty()) {
            slot.id = delta.id();
        }
        String name = delta.functionName();
        if (name != null && !name.isEmpty()) {
            slot.name = name;
        }
        String fragment = delta.argumentsFragment();
        if (fragment != null) {
            slot.arguments.append(fragment);
        }
    }

    public boolean hasOpenSlots() {
        return !open.isEmpty();
    }

    /** Finalizes every open slot, in index order. */
    public List<ToolCallResponse> finalizeOpenSlots() {
        List<ToolCallResponse> calls = new ArrayList<>(open.size());
        for (Slot slot : open.values()) {
            calls.add(slot.toResponse());
            finalized.add(slot.index);
        }
        open.clear();
        if (!calls.isEmpty()) {
            log.debug("Finalized {} tool calls", calls.size());
        }
        return calls;
    }

    private static final class Slot {
        private final int index;
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        private Slot(int index) {
            this.index = index;
        }

        private ToolCallResponse toResponse() {
            return new ToolCallResponse(id != null ? id : "call_" + index,
                    name != null ? name : "", arguments.toString());
        }
    }
}
