package com.bosdb.debugger.inspect;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a database transaction as reported by an instrumented backend.
 */
public record TransactionState(
    String txnId,
    Instant startTime,
    IsolationLevel isolationLevel,
    TransactionStatus status,
    List<Lock> locksHeld,
    List<Lock> locksWaiting,
    List<ModifiedRows> modifiedRows
) {
    public record ModifiedRows(String table, List<String> rowIds) {
        public ModifiedRows {
            rowIds = List.copyOf(rowIds);
        }
    }

    public TransactionState {
        locksHeld = locksHeld != null ? List.copyOf(locksHeld) : List.of();
        locksWaiting = locksWaiting != null ? List.copyOf(locksWaiting) : List.of();
        modifiedRows = modifiedRows != null ? List.copyOf(modifiedRows) : List.of();
    }

    public static TransactionState active(String txnId, IsolationLevel isolationLevel,
                                          List<Lock> locksHeld, List<Lock> locksWaiting) {
        return new TransactionState(txnId, Instant.now(), isolationLevel, TransactionStatus.ACTIVE,
            locksHeld, locksWaiting, List.of());
    }

    public TransactionState withStatus(TransactionStatus status) {
        return new TransactionState(txnId, startTime, isolationLevel, status, locksHeld, locksWaiting, modifiedRows);
    }
}
