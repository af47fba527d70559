package io.github.panghy.tokengraph.storage;

/**
 * A key/value pair returned by a cursor scan.
 */
public record StoredEntry(byte[] key, byte[] value) {}
