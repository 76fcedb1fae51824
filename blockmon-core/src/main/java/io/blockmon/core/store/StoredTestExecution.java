package io.blockmon.core.store;

/** A test as currently stored for an execution. */
public record StoredTestExecution(String testName, double duration, boolean failed, Boolean forced) {}
