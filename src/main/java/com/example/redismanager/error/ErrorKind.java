package com.example.redismanager.error;

/**
 * Closed set of failures a {@link ManagerException} can report.
 * Codes are stable and exposed to callers of the tool surface.
 */
public enum ErrorKind {

    KEY_EXISTS(10, false),
    KEY_NOT_EXIST(11, false),
    INVALID_KEY(12, false),
    BACKEND_INTERNAL(30, true),
    LOCK_INTERNAL(40, true),
    UNKNOWN_INTERNAL(50, true);

    private final int code;
    private final boolean internal;

    ErrorKind(int code, boolean internal) {
        this.code = code;
        this.internal = internal;
    }

    public int getCode() { return code; }

    /**
     * Internal kinds are infrastructure faults; the others are caller conflicts.
     */
    public boolean isInternal() { return internal; }
}
