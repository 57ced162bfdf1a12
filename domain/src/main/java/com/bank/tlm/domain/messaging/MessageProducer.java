package com.bank.tlm.domain.messaging;

/**
 * Abstraction for message producers.
 * Keeps the application layer independent of the broker in use.
 */
public interface MessageProducer {

    /**
     * Send a message to a topic
     * @param topic The topic name
     * @param key The message key (for partitioning/ordering)
     * @param message The message payload
     */
    void send(String topic, String key, Object message);

    /**
     * Send a message without a key
     */
    default void send(String topic, Object message) {
        send(topic, null, message);
    }
}
