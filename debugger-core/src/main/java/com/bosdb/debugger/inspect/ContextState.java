package com.bosdb.debugger.inspect;

import java.util.List;

public record ContextState(
    List<Variable> variables,
    TransactionState transaction    // null when the context has no transaction
) {}
