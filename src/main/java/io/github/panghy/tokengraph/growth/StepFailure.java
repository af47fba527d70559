package io.github.panghy.tokengraph.growth;

/**
 * An expansion step that was skipped because the oracle failed.
 */
public record StepFailure(String token, String message) {}
