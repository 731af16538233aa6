package com.pitwall.analytics.processor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pitwall.analytics.processor.ProcessorTestSupport.T0;
import static com.pitwall.analytics.processor.ProcessorTestSupport.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimingDataProcessorTest {

    @Test
    void recordsOneSnapshotPerLapWithLastWriteWinning() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'Lines':{'1':{'NumberOfLaps':5,'LastLapTime':{'Value':'1:31.000'}}}}", T0));
        processor.process(event("TimingData", "{'Lines':{'1':{'NumberOfLaps':5,'LastLapTime':{'Value':'1:30.500'}}}}", T0.plusSeconds(1)));
        processor.process(event("TimingData", "{'Lines':{'1':{'NumberOfLaps':6,'LastLapTime':{'Value':'1:30.900'}}}}", T0.plusSeconds(91)));

        assertEquals(List.of(5, 6), processor.lapNumbers());
        TimingDataProcessor.LapSnapshot lap5 = processor.lapSnapshot("1", 5);
        assertEquals("1:30.500", lap5.line.path("LastLapTime").path("Value").asText());
        assertEquals(T0.plusSeconds(1), lap5.timestamp);
        assertEquals(2, processor.lapHistory("1").size());
        assertEquals(6, processor.lapHistory("1").get(1).lap);
    }

    @Test
    void lapSnapshotsAreIsolatedFromLaterPatches() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'Lines':{'44':{'NumberOfLaps':3,'Position':'2'}}}"));
        processor.process(event("TimingData", "{'Lines':{'44':{'Position':'1'}}}"));

        assertEquals("2", processor.lapSnapshot("44", 3).line.get("Position").asText());
        assertEquals("1", processor.line("44").get("Position").asText());
    }

    @Test
    void patchesWithoutLapNumberDoNotCreateSnapshots() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'Lines':{'44':{'Position':'1','NumberOfLaps':'7'}}}"));

        assertTrue(processor.lapNumbers().isEmpty());
        assertNull(processor.lapSnapshot("44", 7));
    }

    @Test
    void pitLapFlagFollowsPitOutAndInPit() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'Lines':{'16':{'InPit':true,'NumberOfLaps':20}}}"));
        assertTrue(processor.line("16").get("IsPitLap").asBoolean());

        processor.process(event("TimingData", "{'Lines':{'16':{'InPit':false,'PitOut':true,'NumberOfLaps':21}}}"));
        assertTrue(processor.lapSnapshot("16", 21).line.get("IsPitLap").asBoolean());

        processor.process(event("TimingData", "{'Lines':{'16':{'PitOut':false,'NumberOfLaps':22}}}"));
        assertFalse(processor.lapSnapshot("16", 22).line.get("IsPitLap").asBoolean());
    }

    @Test
    void sessionPartIsCopiedOntoTouchedLines() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'SessionPart':2,'Lines':{'1':{'Position':'1'},'44':{'Position':'2'}}}"));
        processor.process(event("TimingData", "{'Lines':{'1':{'NumberOfLaps':4}}}"));

        assertEquals(2, processor.line("1").get("SessionPart").asInt());
        assertEquals(2, processor.lapSnapshot("1", 4).line.get("SessionPart").asInt());
    }

    @Test
    void bestLapKeepsTheFastestParsedTime() {
        TimingDataProcessor processor = new TimingDataProcessor();
        processor.process(event("TimingData", "{'Lines':{'1':{'BestLapTime':{'Value':'1:31.000'}}}}"));
        processor.process(event("TimingData", "{'Lines':{'1':{'BestLapTime':{'Value':'1:30.500'}},'44':{'BestLapTime':{'Value':''}}}}"));
        processor.process(event("TimingData", "{'Lines':{'1':{'BestLapTime':{'Value':'1:32.000'}}}}"));

        assertEquals("1:30.500", processor.bestLap("1").time);
        assertEquals(90_500L, processor.bestLap("1").timeMs);
        assertNull(processor.bestLap("44"));
        assertEquals(1, processor.bestLaps().size());
    }
}
