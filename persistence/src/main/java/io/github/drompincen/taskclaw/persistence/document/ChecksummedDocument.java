package io.github.drompincen.taskclaw.persistence.document;

import java.time.Instant;

/**
 * A root document whose {@code _meta} carries a checksum over its record collection.
 */
public interface ChecksummedDocument {

    /** The records the checksum covers. */
    Object checksumPayload();

    String storedChecksum();

    void stamp(String checksum, Instant now);
}
