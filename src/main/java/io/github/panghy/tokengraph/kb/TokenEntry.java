package io.github.panghy.tokengraph.kb;

/**
 * A token id with its text.
 */
public record TokenEntry(long id, String text) {}
