package io.blockmon.core.recorder;

/**
 * @param duration seconds
 * @param failed   whether the test failed
 */
public record TestOutcome(double duration, boolean failed) {}
