package io.github.drompincen.taskclaw.runtime.conflict;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;

/**
 * @param errorCode why the claim is refused, {@code null} when allowed
 * @param warning   set when the claim is allowed despite an overlap
 */
public record PolicyDecision(boolean allowed, ErrorCode errorCode, String warning, ConflictVerdict verdict) {

    static PolicyDecision allow(ConflictVerdict verdict) {
        return new PolicyDecision(true, null, null, verdict);
    }

    static PolicyDecision warn(ConflictVerdict verdict) {
        return new PolicyDecision(true, null, verdict.message(), verdict);
    }

    static PolicyDecision block(ErrorCode errorCode, ConflictVerdict verdict) {
        return new PolicyDecision(false, errorCode, null, verdict);
    }
}
