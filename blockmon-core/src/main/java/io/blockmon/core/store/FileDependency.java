package io.blockmon.core.store;

/** A non-source file a test read, with the hash of the content it saw. */
public record FileDependency(String filename, String sha) {}
