package com.bank.tlm.application.support;

import com.bank.tlm.domain.event.TradeLifecycleNotification;
import com.bank.tlm.domain.messaging.MessageProducer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures every lifecycle notification sent
 */
public class RecordingMessageProducer implements MessageProducer {

    private final List<TradeLifecycleNotification> sent = new ArrayList<>();

    @Override
    public synchronized void send(String topic, String key, Object message) {
        sent.add((TradeLifecycleNotification) message);
    }

    public synchronized List<TradeLifecycleNotification> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<TradeLifecycleNotification> sent(TradeLifecycleNotification.Kind kind) {
        return sent.stream().filter(n -> n.getKind() == kind).collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }
}
