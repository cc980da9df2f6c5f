package com.bosdb.debugger.execution;

/**
 * Column description of a result set.
 */
public record Field(String name, String type, boolean nullable) {}
