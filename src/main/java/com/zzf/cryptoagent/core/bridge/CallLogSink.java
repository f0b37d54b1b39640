package com.zzf.cryptoagent.core.bridge;

/**
 * Receives every log entry a bridge produces. Implementations may throw; the bridge reports the
 * failure and carries on.
 */
@FunctionalInterface
public interface CallLogSink {
    CallLogSink NONE = (userId, entry) -> {};

    void persist(String userId, CallLogEntry entry);
}
