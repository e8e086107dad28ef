package com.example.redismanager.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class ManagerException extends RuntimeException {

    private static final Logger logger = LoggerFactory.getLogger(ManagerException.class);

    private final ErrorKind kind;

    public ManagerException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ManagerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind.isInternal()) {
            logger.error("[ ERROR ] Redis-Manager: {}", message, cause);
        } else {
            logger.debug("[ {} ] Redis-Manager: {}", kind, message);
        }
    }

    public ErrorKind getKind() { return kind; }

    public int getCode() { return kind.getCode(); }

    public boolean is(ErrorKind other) { return kind == other; }

    public static ManagerException keyExists(String key) {
        return new ManagerException(ErrorKind.KEY_EXISTS, "Key " + key + " already exists.");
    }

    public static ManagerException keyNotExist(String key) {
        return new ManagerException(ErrorKind.KEY_NOT_EXIST, "Key " + key + " does not exist.");
    }

    public static ManagerException invalidKey(String message) {
        return new ManagerException(ErrorKind.INVALID_KEY, message);
    }
}
