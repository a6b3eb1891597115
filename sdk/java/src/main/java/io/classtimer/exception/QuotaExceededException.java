package io.classtimer.exception;

/**
 * Thrown by a storage backend when a write would exceed its capacity.
 */
public class QuotaExceededException extends StorageException {

    private final long quota;

    public QuotaExceededException(String key, long quota) {
        super(StorageErrorCode.QUOTA_EXCEEDED, key,
            "Storage quota of " + quota + " characters exceeded. Cannot store key \"" + key + "\"");
        this.quota = quota;
    }

    public long getQuota() {
        return quota;
    }
}
