package scanagram.core.model.report;

import java.time.Duration;
import java.time.Instant;

import scanagram.core.model.ratelimit.LimiterSnapshot;

/**
 * How a report was collected.
 *
 * @param generatedAt         when collection finished
 * @param duration            wall time spent collecting, waits included
 * @param postsAnalyzed       posts that went into the analysis
 * @param maxPosts            configured cap on collected posts
 * @param truncated           whether paging stopped early because a page failed
 * @param skippedPrivate      whether posts were skipped because the profile is private
 * @param rateLimit           limiter statistics at the end of collection
 */
public record CollectionSummary(
        Instant generatedAt,
        Duration duration,
        int postsAnalyzed,
        int maxPosts,
        boolean truncated,
        boolean skippedPrivate,
        LimiterSnapshot rateLimit) {}
