package com.pitwall.analytics.analysis;

import com.pitwall.analytics.model.TrackPhase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackStatusSemanticsTest {

    @Test
    void greenFromStatusCodeOrAllClearMessage() {
        assertTrue(TrackStatusSemantics.isGreen("1", null));
        assertTrue(TrackStatusSemantics.isGreen(null, "AllClear"));
        assertTrue(TrackStatusSemantics.isGreen(" Green ", ""));
        assertFalse(TrackStatusSemantics.isGreen("4", "SCDeployed"));
        assertFalse(TrackStatusSemantics.isGreen(null, null));
    }

    @Test
    void statusCodesMapToPhases() {
        assertEquals(TrackPhase.GREEN, TrackStatusSemantics.classifyPhase("1", null));
        assertEquals(TrackPhase.YELLOW, TrackStatusSemantics.classifyPhase("2", null));
        assertEquals(TrackPhase.SC, TrackStatusSemantics.classifyPhase("4", null));
        assertEquals(TrackPhase.RED, TrackStatusSemantics.classifyPhase("5", null));
        assertEquals(TrackPhase.VSC, TrackStatusSemantics.classifyPhase("6", null));
        assertEquals(TrackPhase.VSC, TrackStatusSemantics.classifyPhase("7", "VSCEnding"));
    }

    @Test
    void unmappedCodesFallBackToMessageKeywords() {
        assertEquals(TrackPhase.VSC, TrackStatusSemantics.classifyPhase(null, "Virtual Safety Car deployed"));
        assertEquals(TrackPhase.VSC, TrackStatusSemantics.classifyPhase("", "VSC"));
        assertEquals(TrackPhase.SC, TrackStatusSemantics.classifyPhase(null, "Safety Car in this lap"));
        assertEquals(TrackPhase.RED, TrackStatusSemantics.classifyPhase("9", "Red flag"));
        assertEquals(TrackPhase.YELLOW, TrackStatusSemantics.classifyPhase(null, "Double yellow in sector 2"));
        assertEquals(TrackPhase.GREEN, TrackStatusSemantics.classifyPhase(null, "All Clear"));
        assertEquals(TrackPhase.UNKNOWN, TrackStatusSemantics.classifyPhase(null, "Track limits"));
    }
}
