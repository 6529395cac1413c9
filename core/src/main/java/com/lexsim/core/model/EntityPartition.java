package com.lexsim.core.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of entity IDs owned by exactly one node.
 * <p>
 * Mutable while the partition manager fills it; callers only ever receive
 * {@link #copy() copies}. {@link #size()} is always the length of the entity list.
 * </p>
 * <p>
 * <b>Thread-safety:</b> none. The owning partition manager guards all access.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EntityPartition {
    /**
     * Unique across the lifetime of the partition manager, never reused.
     */
    private final int id;

    /**
     * Owning node.
     */
    private int nodeId;

    @Getter(AccessLevel.NONE)
    private final List<String> entityIds;

    public EntityPartition(int id, int nodeId) {
        this(id, nodeId, new ArrayList<>());
    }

    private EntityPartition(int id, int nodeId, List<String> entityIds) {
        this.id = id;
        this.nodeId = nodeId;
        this.entityIds = entityIds;
    }

    public void addEntity(String entityId) {
        entityIds.add(entityId);
    }

    public void addEntities(Collection<String> ids) {
        entityIds.addAll(ids);
    }

    /**
     * Removes the entity if present.
     *
     * @return true if the entity was part of this partition
     */
    public boolean removeEntity(String entityId) {
        return entityIds.remove(entityId);
    }

    public boolean contains(String entityId) {
        return entityIds.contains(entityId);
    }

    /**
     * Read-only view of the entity IDs in assignment order.
     */
    public List<String> getEntityIds() {
        return Collections.unmodifiableList(entityIds);
    }

    public int size() {
        return entityIds.size();
    }

    public boolean isEmpty() {
        return entityIds.isEmpty();
    }

    /**
     * Changes the owner. Used when a caller executes a rebalance move.
     */
    public void assignTo(int nodeId) {
        this.nodeId = nodeId;
    }

    public EntityPartition copy() {
        return new EntityPartition(id, nodeId, new ArrayList<>(entityIds));
    }
}
