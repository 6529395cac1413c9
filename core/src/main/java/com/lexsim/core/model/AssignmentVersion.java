package com.lexsim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Identifies one entity-to-node layout.
 * <p>
 * The coordinator issues a new version after every distribution. Two coordinators that
 * placed the same entities the same way report the same {@code versionHash}, so a driver
 * holding an older hash knows its view of the partitions is out of date.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class AssignmentVersion {
    /**
     * Distribution count for the issuing coordinator, starting at 1.
     */
    @JsonProperty("version")
    long version;

    /**
     * Read from the coordinator's clock.
     */
    @JsonProperty("issuedAt")
    Instant issuedAt;

    /**
     * Murmur3 hex over every partition's id, owner and entity ids, in creation order.
     */
    @JsonProperty("versionHash")
    String versionHash;

    @JsonCreator
    public AssignmentVersion(
        @JsonProperty("version") long version,
        @JsonProperty("issuedAt") Instant issuedAt,
        @JsonProperty("versionHash") String versionHash
    ) {
        this.version = version;
        this.issuedAt = issuedAt;
        this.versionHash = versionHash;
    }

    /**
     * Whether both versions describe the same placement, regardless of when or by whom they were issued.
     */
    public boolean sameLayoutAs(AssignmentVersion other) {
        return other != null && versionHash.equals(other.versionHash);
    }
}
