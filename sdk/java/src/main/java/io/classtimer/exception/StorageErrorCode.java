package io.classtimer.exception;

/**
 * Failure categories for storage operations.
 */
public enum StorageErrorCode {
    QUOTA_EXCEEDED,
    PARSE_ERROR,
    NOT_FOUND,
    SERIALIZATION_ERROR
}
