package com.example.dungeonquest.persistence;

/**
 * Malformed static content (unknown skill type, bad numbers, dangling references).
 * Raised while loading, never during combat.
 */
public class ContentException extends Exception {

    public ContentException(String message) {
        super(message);
    }

    public ContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
