package io.github.panghy.tokengraph.kb;

public record BulkImportResult(int imported, int skipped) {}
