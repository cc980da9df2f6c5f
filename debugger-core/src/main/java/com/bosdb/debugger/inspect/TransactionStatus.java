package com.bosdb.debugger.inspect;

public enum TransactionStatus {
    ACTIVE,
    PREPARING,
    PREPARED,
    COMMITTING,
    COMMITTED,
    ABORTING,
    ABORTED
}
