package com.pitwall.analytics.processor;

import com.pitwall.analytics.model.NormalizedEvent;

/**
 * Topic filter shared by all processors; subclasses only see events of their own topic.
 */
public abstract class AbstractTopicProcessor implements TopicProcessor {
    private final String topic;

    protected AbstractTopicProcessor(String topic) {
        this.topic = topic;
    }

    @Override
    public final String topic() {
        return topic;
    }

    @Override
    public final void process(NormalizedEvent event) {
        if (event == null || !event.isTopic(topic)) {
            return;
        }
        apply(event);
    }

    protected abstract void apply(NormalizedEvent event);
}
