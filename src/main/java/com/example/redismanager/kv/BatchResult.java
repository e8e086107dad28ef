package com.example.redismanager.kv;

/**
 * Per-step outcome of a set-then-expire transaction.
 */
public class BatchResult {
    private final boolean setApplied;
    private final Boolean expireApplied;

    private BatchResult(boolean setApplied, Boolean expireApplied) {
        this.setApplied = setApplied;
        this.expireApplied = expireApplied;
    }

    public static BatchResult of(boolean setApplied) {
        return new BatchResult(setApplied, null);
    }

    public static BatchResult of(boolean setApplied, boolean expireApplied) {
        return new BatchResult(setApplied, expireApplied);
    }

    public boolean isSetApplied() { return setApplied; }

    /** {@code null} when no expire step was queued. */
    public Boolean getExpireApplied() { return expireApplied; }

    public boolean isExpireRequested() { return expireApplied != null; }

    @Override
    public String toString() {
        return "BatchResult{set=" + setApplied + ", expire=" + expireApplied + "}";
    }
}
