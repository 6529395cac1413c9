package com.lexsim.coordinator.channel;

import com.lexsim.core.msg.Message;
import com.lexsim.core.msg.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Optional;

/**
 * Single global FIFO queue filtered by receiver.
 * <p>
 * <b>Broadcast semantics:</b> a broadcast message is removed by the first node that
 * receives it; other nodes never see it. Fan-out to every node would need per-node
 * cursors or per-node copies.
 * </p>
 * <p>
 * <b>Capacity:</b> unbounded, no backpressure. A production transport needs a bound and
 * an explicit drop or block policy.
 * </p>
 * <p>
 * <b>Thread-safety:</b> one monitor guards both the queue and the ID counter, so IDs are
 * assigned in enqueue order.
 * </p>
 */
public class InMemoryMessageChannel implements IMessageChannel {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageChannel.class);

    private final LinkedList<Message> queue = new LinkedList<>();
    private final Clock clock;
    private long nextId = 0;

    public InMemoryMessageChannel() {
        this(Clock.systemUTC());
    }

    public InMemoryMessageChannel(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long send(int source, Integer destination, Payload payload) {
        long id = nextId++;
        queue.addLast(Message.builder()
            .id(id)
            .source(source)
            .destination(destination)
            .payload(payload)
            .timestamp(clock.instant().getEpochSecond())
            .build());

        log.debug("Enqueued message {} ({}) from {} to {}",
            id, payload.type(), source, destination == null ? "*" : destination);
        return id;
    }

    @Override
    public synchronized Optional<Message> receive(int nodeId) {
        Iterator<Message> it = queue.iterator();
        while (it.hasNext()) {
            Message message = it.next();
            if (message.isVisibleTo(nodeId)) {
                it.remove();
                log.debug("Node {} received message {}", nodeId, message.getId());
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<Message> peek(int nodeId) {
        return queue.stream()
            .filter(message -> message.isVisibleTo(nodeId))
            .findFirst();
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }

    @Override
    public synchronized void clear() {
        queue.clear();
    }
}
