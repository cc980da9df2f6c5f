package com.bosdb.debugger.inspect;

import java.util.List;

/**
 * Who a transaction blocks and who blocks it, as transaction ids.
 */
public record BlockingTree(List<String> blocked, List<String> blockedBy) {
    public BlockingTree {
        blocked = List.copyOf(blocked);
        blockedBy = List.copyOf(blockedBy);
    }

    public static BlockingTree empty() {
        return new BlockingTree(List.of(), List.of());
    }
}
