package com.taskpilot.planner;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NarrationStreamFilterTest {

    private final List<String> tokens = new ArrayList<>();
    private final NarrationStreamFilter filter = new NarrationStreamFilter(tokens::add);

    private static List<String> randomChunks(String text, Random random) {
        List<String> chunks = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            int size = 1 + random.nextInt(6);
            int end = Math.min(text.length(), index + size);
            chunks.add(text.substring(index, end));
            index = end;
        }
        return chunks;
    }

    @RepeatedTest(25)
    void testNarrationIsReconstructedUnderAnyChunking() {
        String text = "Sure! I can help with that.\n\nFirst, `inline code` and ``double`` ticks; then a list:\n- one\n- two";
        randomChunks(text, new Random()).forEach(filter::accept);
        filter.finish();

        assertEquals(text, String.join("", tokens));
    }

    @RepeatedTest(25)
    void testStructuredOutputIsWithheld() {
        String text = "Let me check the files.\n```json\n{\"steps\": [{\"tool\": \"list_directory\"}]}\n```";
        randomChunks(text, new Random()).forEach(filter::accept);
        filter.finish();

        assertEquals("Let me check the files.\n", String.join("", tokens));
        assertTrue(filter.isStructured());
        assertEquals(text, filter.received());
    }

    @Test
    void testBareJsonWithLeadingWhitespaceEmitsNothing() {
        filter.accept("\n  ");
        filter.accept(" {\"steps\":");
        filter.accept("[]}");
        filter.finish();

        assertTrue(tokens.isEmpty());
    }

    @Test
    void testRemainderIsFlushedForConversationalAnswer() {
        filter.accept("The template uses ");
        filter.accept("{name} placeholders.");
        filter.flushRemainder("The template uses {name} placeholders.");

        assertEquals("The template uses {name} placeholders.", String.join("", tokens));
    }

    @Test
    void testRemainderIsSkippedWhenAnswerDiffers() {
        filter.accept("Done. ");
        filter.accept("{\"response\": \"All files listed.\"}");
        filter.flushRemainder("All files listed.");

        assertEquals("Done. ", String.join("", tokens));
    }

    @Test
    void testTrailingBackticksAreHeldUntilResolved() {
        filter.accept("Run ``");
        assertEquals("Run ", String.join("", tokens));

        filter.accept("x`` now");
        filter.finish();

        assertEquals("Run ``x`` now", String.join("", tokens));
    }

    @Test
    void testFenceSplitAcrossChunksStopsNarration() {
        filter.accept("Plan:\n``");
        filter.accept("`json\n{}");
        filter.finish();

        assertEquals("Plan:\n", String.join("", tokens));
    }
}
