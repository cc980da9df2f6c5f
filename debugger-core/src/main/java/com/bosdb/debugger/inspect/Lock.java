package com.bosdb.debugger.inspect;

import java.time.Instant;
import java.util.List;

/**
 * A lock held or awaited by a transaction, with the transactions it waits on and blocks.
 */
public record Lock(
    String id,
    String txnId,
    LockType lockType,
    LockMode lockMode,
    String resourceType,
    String resourceId,
    LockStatus status,
    Instant acquiredAt,
    Instant waitingSince,
    Instant releasedAt,
    List<String> blockedBy,
    List<String> blocking
) {
    public enum LockType { ROW, PAGE, TABLE, ADVISORY }

    public enum LockMode { SHARED, EXCLUSIVE, UPDATE }

    public enum LockStatus { ACQUIRED, WAITING, RELEASED }

    public Lock {
        blockedBy = blockedBy != null ? List.copyOf(blockedBy) : List.of();
        blocking = blocking != null ? List.copyOf(blocking) : List.of();
    }

    /**
     * A granted lock blocking the given transactions.
     */
    public static Lock held(String id, String txnId, LockType lockType, LockMode lockMode,
                            String resourceType, String resourceId, List<String> blocking) {
        return new Lock(id, txnId, lockType, lockMode, resourceType, resourceId, LockStatus.ACQUIRED,
            Instant.now(), null, null, List.of(), blocking);
    }

    /**
     * A lock request waiting on the given transactions.
     */
    public static Lock waiting(String id, String txnId, LockType lockType, LockMode lockMode,
                               String resourceType, String resourceId, List<String> blockedBy) {
        return new Lock(id, txnId, lockType, lockMode, resourceType, resourceId, LockStatus.WAITING,
            null, Instant.now(), null, blockedBy, List.of());
    }
}
