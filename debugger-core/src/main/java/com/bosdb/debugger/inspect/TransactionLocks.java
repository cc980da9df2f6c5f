package com.bosdb.debugger.inspect;

import java.util.List;

public record TransactionLocks(List<Lock> held, List<Lock> waiting) {
    public static TransactionLocks none() {
        return new TransactionLocks(List.of(), List.of());
    }
}
