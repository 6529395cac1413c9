package com.lexsim.coordinator.channel;

import com.lexsim.core.msg.Message;
import com.lexsim.core.msg.Payload;

import java.util.Optional;

/**
 * Ordered node-to-node message delivery (Dependency Inversion Principle).
 * <p>
 * Abstracts the transport so an in-memory queue can be swapped for a network
 * transport without touching partitioning or balancing logic.
 * </p>
 */
public interface IMessageChannel {

    /**
     * Enqueues a message and assigns it the next sequential ID.
     *
     * @param source      Sending node
     * @param destination Target node, or {@code null} to broadcast
     * @param payload     Message payload
     * @return The assigned message ID
     */
    long send(int source, Integer destination, Payload payload);

    /**
     * Removes and returns the oldest message addressed to {@code nodeId} or broadcast.
     * Returns immediately; never blocks.
     */
    Optional<Message> receive(int nodeId);

    /**
     * Same matching rule as {@link #receive(int)}, without removing the message.
     */
    Optional<Message> peek(int nodeId);

    /**
     * Number of messages waiting, for all receivers.
     */
    int size();

    void clear();
}
