package survey.model.service.pipeline;

import java.time.Instant;

/** What one {@link AnalysisPipeline#processBatch} call did, for logs and the CLI. */
public record BatchSummary(
    int received, int analyzed, int skipped, int clusters, int themesUpdated, Instant startedAt, Instant finishedAt
) {}
