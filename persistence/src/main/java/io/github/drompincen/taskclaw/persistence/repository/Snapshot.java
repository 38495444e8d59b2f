package io.github.drompincen.taskclaw.persistence.repository;

/**
 * A document as read from disk.
 *
 * @param raw         the exact bytes read, kept so a failed multi-document operation can put them back
 * @param fingerprint SHA-256 of {@code raw}
 */
public record Snapshot<T>(T document, byte[] raw, String fingerprint) {}
