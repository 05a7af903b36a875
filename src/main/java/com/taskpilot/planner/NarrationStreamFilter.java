package com.taskpilot.planner;

import java.util.function.Consumer;

/**
 * Forwards streamed model text while it is narration and withholds it once structured output
 * starts (an opening brace or a code fence). Backticks at the end of a chunk and a
 * whitespace-only prefix are held until the next chunk tells which side they belong to.
 * Not thread-safe; one instance per model response.
 */
class NarrationStreamFilter {

    private static final String FENCE = "```";

    private final Consumer<String> downstream;
    private final StringBuilder received = new StringBuilder();
    private final StringBuilder emitted = new StringBuilder();
    private String held = "";
    private boolean structured;

    NarrationStreamFilter(Consumer<String> downstream) {
        this.downstream = downstream;
    }

    void accept(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        received.append(chunk);
        if (structured) {
            return;
        }
        String pending = held + chunk;
        held = "";
        int start = structureStart(pending);
        if (start >= 0) {
            structured = true;
            String narration = pending.substring(0, start);
            if (emitted.length() > 0 || !narration.isBlank()) {
                emit(narration);
            }
            return;
        }
        if (emitted.length() == 0 && pending.isBlank()) {
            held = pending;
            return;
        }
        int keep = trailingBackticks(pending);
        emit(pending.substring(0, pending.length() - keep));
        held = pending.substring(pending.length() - keep);
    }

    /**
     * Releases anything held back when the stream ended while still narrating.
     */
    void finish() {
        if (!structured && !held.isEmpty()) {
            emit(held);
        }
        held = "";
    }

    /**
     * Emits the part of a conversational answer that was withheld, provided the answer
     * continues what has already been sent.
     */
    void flushRemainder(String response) {
        finish();
        if (response == null) {
            return;
        }
        String sent = emitted.toString();
        if (response.length() > sent.length() && response.startsWith(sent)) {
            emit(response.substring(sent.length()));
        }
    }

    String received() {
        return received.toString();
    }

    String emitted() {
        return emitted.toString();
    }

    boolean isStructured() {
        return structured;
    }

    private void emit(String text) {
        if (text.isEmpty()) {
            return;
        }
        emitted.append(text);
        downstream.accept(text);
    }

    private static int structureStart(String text) {
        int brace = text.indexOf('{');
        int fence = text.indexOf(FENCE);
        if (brace < 0) {
            return fence;
        }
        if (fence < 0) {
            return brace;
        }
        return Math.min(brace, fence);
    }

    private static int trailingBackticks(String text) {
        int count = 0;
        for (int i = text.length() - 1; i >= 0 && count < FENCE.length() - 1; i--) {
            if (text.charAt(i) != '`') {
                break;
            }
            count++;
        }
        return count;
    }
}
