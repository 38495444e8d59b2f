package io.github.drompincen.taskclaw.persistence.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Shared Jackson setup for the on-disk documents, plus the hashing helpers the
 * repositories use for checksums and fingerprints.
 */
public final class TaskClawJson {

    private static final int CHECKSUM_LENGTH = 16;

    private TaskClawJson() {}

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /** First 16 hex chars of the SHA-256 of the compact JSON form of {@code value}. */
    public static String checksum(ObjectMapper mapper, Object value) {
        try {
            byte[] compact = mapper.writer()
                    .without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsBytes(value);
            return sha256(compact).substring(0, CHECKSUM_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize checksum payload", e);
        }
    }

    public static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
