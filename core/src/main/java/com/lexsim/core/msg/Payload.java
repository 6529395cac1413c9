package com.lexsim.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.lexsim.core.model.NodeStatus;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Control and status payloads exchanged between nodes.
 * <p>
 * Closed set: the constructor is private, so the nested classes below are the only
 * variants. Dispatch on {@link #type()} with a {@code switch}.
 * </p>
 * <p>
 * Serialized with a {@code kind} discriminator so a real transport can ship payloads
 * unchanged.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Payload.Barrier.class, name = "barrier"),
    @JsonSubTypes.Type(value = Payload.EntityData.class, name = "entity-data"),
    @JsonSubTypes.Type(value = Payload.Results.class, name = "results"),
    @JsonSubTypes.Type(value = Payload.LoadBalance.class, name = "load-balance"),
    @JsonSubTypes.Type(value = Payload.Checkpoint.class, name = "checkpoint"),
    @JsonSubTypes.Type(value = Payload.StatusUpdate.class, name = "status-update"),
    @JsonSubTypes.Type(value = Payload.Custom.class, name = "custom")
})
public abstract class Payload {

    private Payload() {
    }

    /**
     * Variant tag.
     */
    public abstract Type type();

    public enum Type {
        BARRIER,
        ENTITY_DATA,
        RESULTS,
        LOAD_BALANCE,
        CHECKPOINT,
        STATUS_UPDATE,
        CUSTOM
    }

    public static Payload barrier() {
        return new Barrier();
    }

    public static Payload entityData(List<String> entityIds) {
        return new EntityData(entityIds);
    }

    public static Payload results(RunMetrics metrics) {
        return new Results(metrics);
    }

    public static Payload loadBalance() {
        return new LoadBalance();
    }

    public static Payload checkpoint() {
        return new Checkpoint();
    }

    public static Payload statusUpdate(NodeStatus status) {
        return new StatusUpdate(status);
    }

    public static Payload custom(String body) {
        return new Custom(body);
    }

    /**
     * Barrier signal. Fire-and-forget; receivers do not acknowledge.
     */
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Barrier extends Payload {
        @Override
        public Type type() {
            return Type.BARRIER;
        }
    }

    /**
     * Entity IDs handed from one node to another.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class EntityData extends Payload {
        @JsonProperty("entityIds")
        List<String> entityIds;

        @JsonCreator
        public EntityData(@JsonProperty("entityIds") List<String> entityIds) {
            this.entityIds = List.copyOf(entityIds);
        }

        @Override
        public Type type() {
            return Type.ENTITY_DATA;
        }
    }

    /**
     * Run results reported by a node.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Results extends Payload {
        @JsonProperty("metrics")
        RunMetrics metrics;

        @JsonCreator
        public Results(@JsonProperty("metrics") RunMetrics metrics) {
            this.metrics = metrics;
        }

        @Override
        public Type type() {
            return Type.RESULTS;
        }
    }

    /**
     * Notification that a rebalance plan was computed.
     */
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class LoadBalance extends Payload {
        @Override
        public Type type() {
            return Type.LOAD_BALANCE;
        }
    }

    /**
     * Checkpoint trigger.
     */
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Checkpoint extends Payload {
        @Override
        public Type type() {
            return Type.CHECKPOINT;
        }
    }

    /**
     * Node status change.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class StatusUpdate extends Payload {
        @JsonProperty("status")
        NodeStatus status;

        @JsonCreator
        public StatusUpdate(@JsonProperty("status") NodeStatus status) {
            this.status = status;
        }

        @Override
        public Type type() {
            return Type.STATUS_UPDATE;
        }
    }

    /**
     * Free-form application message.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Custom extends Payload {
        @JsonProperty("body")
        String body;

        @JsonCreator
        public Custom(@JsonProperty("body") String body) {
            this.body = body;
        }

        @Override
        public Type type() {
            return Type.CUSTOM;
        }
    }
}
