package com.pitwall.analytics.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitwall.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TimingLineSemanticsTest {

    @Test
    void lapTimePrefersLastLapThenLapTimeThenSectorSum() {
        assertEquals(91_234L, TimingLineSemantics.extractLapTimeMs(json(
                "{'LastLapTime':{'Value':'1:31.234'},'LapTime':{'Value':'1:40.000'}}")));
        assertEquals(100_000L, TimingLineSemantics.extractLapTimeMs(json(
                "{'LastLapTime':{'Value':''},'LapTime':{'Value':'1:40.000'}}")));
        assertEquals(90_600L, TimingLineSemantics.extractLapTimeMs(json("{'Sectors':["
                + "{'Value':'28.100'},{'PreviousValue':'30.200','Value':'31.000'},{'Value':'32.300'}]}")));
    }

    @Test
    void sectorSumAcceptsIndexKeyedSectors() {
        assertEquals(90_000L, TimingLineSemantics.extractLapTimeMs(json("{'Sectors':{"
                + "'2':{'Value':'32.000'},'0':{'Value':'28.000'},'1':{'Value':'30.000'}}}")));
    }

    @Test
    void incompleteOrUnparseableLapTimeIsNull() {
        assertNull(TimingLineSemantics.extractLapTimeMs(json("{'Sectors':[{'Value':'28.1'},{'Value':'30.200'}]}")));
        assertNull(TimingLineSemantics.extractLapTimeMs(json(
                "{'Sectors':[{'Value':'28.100'},{'Value':'x'},{'Value':'32.300'}]}")));
        assertNull(TimingLineSemantics.extractLapTimeMs(json("{'LastLapTime':{'Value':'DNF'}}")));
        assertNull(TimingLineSemantics.extractLapTimeMs(null));
    }

    @Test
    void linesAreOrderedByLineThenPositionWithUnplacedLast() {
        Map<String, JsonNode> lines = new LinkedHashMap<>();
        lines.put("99", json("{}"));
        lines.put("16", json("{'Line':3}"));
        lines.put("1", json("{'Position':'1'}"));
        lines.put("44", json("{'Line':'2','Position':'7'}"));

        List<Map.Entry<String, JsonNode>> ordered = TimingLineSemantics.orderedLines(lines);

        assertEquals(List.of("1", "44", "16", "99"), List.of(
                ordered.get(0).getKey(), ordered.get(1).getKey(), ordered.get(2).getKey(), ordered.get(3).getKey()));
    }

    @Test
    void lappedGapIsRebuiltFromIntervals() {
        Map<String, JsonNode> lines = new LinkedHashMap<>();
        lines.put("1", json("{'Line':1,'GapToLeader':'LAP 40','IntervalToPositionAhead':{'Value':''}}"));
        lines.put("44", json("{'Line':2,'GapToLeader':'+1.500','IntervalToPositionAhead':{'Value':'+1.500'}}"));
        lines.put("16", json("{'Line':3,'GapToLeader':'1 L','IntervalToPositionAhead':{'Value':'+0.700'}}"));
        lines.put("63", json("{'Line':4,'GapToLeader':'1 L','IntervalToPositionAhead':{'Value':'+1.100'}}"));
        lines.put("2", json("{'Line':5,'GapToLeader':'2 L'}"));
        List<Map.Entry<String, JsonNode>> ordered = TimingLineSemantics.orderedLines(lines);

        assertEquals(0.0, TimingLineSemantics.smartGapToLeaderSeconds(ordered, "1"), 1e-9);
        assertEquals(1.5, TimingLineSemantics.smartGapToLeaderSeconds(ordered, "44"), 1e-9);
        assertEquals(2.2, TimingLineSemantics.smartGapToLeaderSeconds(ordered, "16"), 1e-9);
        assertEquals(3.3, TimingLineSemantics.smartGapToLeaderSeconds(ordered, "63"), 1e-9);
        assertNull(TimingLineSemantics.smartGapToLeaderSeconds(ordered, "2"));
        assertNull(TimingLineSemantics.smartGapToLeaderSeconds(ordered, "77"));
    }

    private static JsonNode json(String singleQuoted) {
        try {
            return JsonSupport.MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new IllegalArgumentException(ex);
        }
    }
}
