package com.questrail.kernel.compaction;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputSignalScorerTest {

    private final OutputSignalScorer scorer = new OutputSignalScorer(CompactionThresholds.defaults());

    @Test
    void lexicalMarkerIsFoundThroughEscapeSequences() {
        CompactionSignal s = scorer.score("\u001B[1mCompacting\u001B[0m conversation...", 0);

        assertTrue(s.kinds().contains(SignalKind.LEXICAL));
        assertTrue(s.kinds().contains(SignalKind.NO_CAUSATION));
        assertEquals(0.5, s.score(), 1e-9);
    }

    @Test
    void summaryHeadingIsStructured() {
        CompactionSignal s = scorer.score("## Summary\nwork so far\n", 0);
        assertTrue(s.kinds().contains(SignalKind.STRUCTURED));
    }

    @Test
    void recentInjectionExplainsTheOutput() {
        scorer.onInjectRequested(1_000);

        assertFalse(scorer.score("building module core", 5_000).kinds().contains(SignalKind.NO_CAUSATION));
        assertTrue(scorer.score("building module core", 11_000).kinds().contains(SignalKind.NO_CAUSATION));
    }

    @Test
    void blankOutputCarriesNoEvidence() {
        CompactionSignal s = scorer.score("   ", 0);
        assertEquals(Set.of(), s.kinds());
        assertEquals(0.0, s.score(), 1e-9);
    }

    @Test
    void burstWithoutPromptIsCountedAndPromptResetsIt() {
        for (int i = 0; i < 4; i++) {
            assertFalse(scorer.score("line " + i, 0).kinds().contains(SignalKind.BURST_NO_PROMPT));
        }
        assertTrue(scorer.score("line 4", 0).kinds().contains(SignalKind.BURST_NO_PROMPT));

        CompactionSignal prompt = scorer.score("user@host $ ", 0);
        assertTrue(prompt.promptReady());
        assertFalse(scorer.score("line 5", 0).kinds().contains(SignalKind.BURST_NO_PROMPT));
    }

    @Test
    void promptIsRecognizedOnAnyLineOfTheChunk() {
        assertTrue(scorer.score("user@host $ \nlast login: today", 0).promptReady());
        assertTrue(scorer.score("done\n>\n", 0).promptReady());
        assertFalse(scorer.score("cost was $5 per line", 0).promptReady());
    }

    @Test
    void scoreIsCappedAtOne() {
        for (int i = 0; i < 4; i++) {
            scorer.score("x", 0);
        }
        CompactionSignal s = scorer.score("Compacting conversation\n## Summary\n", 0);
        assertEquals(4, s.kinds().size());
        assertEquals(1.0, s.score(), 1e-9);
    }
}
