package com.pitwall.analytics.processor;

import org.junit.jupiter.api.Test;

import static com.pitwall.analytics.processor.ProcessorTestSupport.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CarDataProcessorTest {

    @Test
    void keepsOnlyTheLastSampleOfTheLatestBatch() {
        CarDataProcessor processor = new CarDataProcessor();
        processor.process(event(CarDataProcessor.TOPIC, "{'Entries':["
                + "{'Utc':'2024-03-02T15:00:00.1Z','Cars':{'1':{'Channels':{'0':10500,'2':281}}}},"
                + "{'Utc':'2024-03-02T15:00:00.3Z','Cars':{'1':{'Channels':{'0':10800,'2':287}}}}]}"));

        assertEquals(1, processor.latest().get("Entries").size());
        assertEquals(287, processor.channelsFor("1").get("2").asInt());
        assertNull(processor.channelsFor("44"));

        processor.process(event(CarDataProcessor.TOPIC, "{'Entries':[]}"));
        assertEquals(287, processor.channelsFor("1").get("2").asInt());
    }
}
