package com.lexsim.core.model;

/**
 * Advisory instruction to relocate one partition from one node to another.
 * <p>
 * Not self-executing: the caller that acts on it must remove the partition's entities
 * from the source before adding them elsewhere, then report the new counts.
 * </p>
 */
public record RebalanceMove(int partitionId, int fromNode, int toNode) {
}
