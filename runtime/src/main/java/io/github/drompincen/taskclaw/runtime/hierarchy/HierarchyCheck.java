package io.github.drompincen.taskclaw.runtime.hierarchy;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;

/**
 * @param depth depth the new child would sit at, root tasks being depth 0
 */
public record HierarchyCheck(boolean allowed, ErrorCode errorCode, String message, int depth) {

    public static HierarchyCheck ok(int depth) {
        return new HierarchyCheck(true, null, null, depth);
    }

    public static HierarchyCheck rejected(ErrorCode errorCode, String message) {
        return new HierarchyCheck(false, errorCode, message, -1);
    }
}
