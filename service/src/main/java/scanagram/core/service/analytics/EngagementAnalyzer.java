package scanagram.core.service.analytics;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import scanagram.core.config.AnalyticsConfig;
import scanagram.core.model.profile.PostRecord;
import scanagram.core.model.report.EngagementReport;
import scanagram.core.model.report.RankedCount;
import scanagram.core.model.report.TopPost;
import scanagram.core.util.Decimals;

/**
 * Derives engagement and posting-time statistics from a set of posts.
 *
 * <p>
 * Analysis is pure: the same posts and follower count always produce an equal
 * report. Posts are first sorted chronologically (stable, so posts with equal
 * timestamps keep their input order); every tie below is broken by that order.
 *
 * <p>
 * Hours and days are taken in each post's own offset.
 */
@ApplicationScoped
public class EngagementAnalyzer {

    private static final Comparator<PostRecord> CHRONOLOGICAL =
            Comparator.comparing(post -> post.timestamp().toInstant());

    private static final double NANOS_PER_HOUR = Duration.ofHours(1).toNanos();

    private final int topN;
    private final int topPosts;

    @Inject
    public EngagementAnalyzer(AnalyticsConfig config) {
        this(config.topN(), config.topPosts());
    }

    public EngagementAnalyzer(int topN, int topPosts) {
        if (topN < 0 || topPosts < 0) {
            throw new IllegalArgumentException("Ranking sizes must not be negative");
        }
        this.topN = topN;
        this.topPosts = topPosts;
    }

    /**
     * Analyze posts against the profile's follower count.
     *
     * @param posts     the posts, in any order
     * @param followers follower count; zero or less marks the rate as low confidence
     * @return the report; empty input yields a report flagged empty
     */
    public EngagementReport analyze(List<PostRecord> posts, long followers) {
        final var sorted = new ArrayList<>(posts == null ? List.<PostRecord>of() : posts);
        sorted.sort(CHRONOLOGICAL);

        final var sampleSize = sorted.size();
        final var empty = sampleSize == 0;

        var totalLikes = 0L;
        var totalComments = 0L;
        for (final var post : sorted) {
            totalLikes += post.likes();
            totalComments += post.comments();
        }

        final var avgLikes = empty ? 0.0 : (double) totalLikes / sampleSize;
        final var avgComments = empty ? 0.0 : (double) totalComments / sampleSize;
        final var engagementRate = Decimals.round((avgLikes + avgComments) / Math.max(1L, followers) * 100.0, 3);

        final var hours = hourDistribution(sorted);

        return new EngagementReport(
                sampleSize,
                empty,
                totalLikes,
                totalComments,
                Decimals.round(avgLikes, 2),
                Decimals.round(avgComments, 2),
                engagementRate,
                empty || followers <= 0,
                peakHour(hours),
                hours,
                dayDistribution(sorted),
                averageIntervalHours(sorted),
                rank(sorted, post -> new ArrayList<>(post.hashtags())),
                rank(sorted, post -> post.location() == null ? List.of() : List.of(post.location().name())),
                topPosts(sorted));
    }

    private static Map<Integer, Long> hourDistribution(List<PostRecord> sorted) {
        if (sorted.isEmpty()) {
            return Map.of();
        }
        final var hours = new TreeMap<Integer, Long>();
        for (var hour = 0; hour < 24; hour++) {
            hours.put(hour, 0L);
        }
        for (final var post : sorted) {
            hours.merge(post.timestamp().getHour(), 1L, Long::sum);
        }
        return hours;
    }

    private static Integer peakHour(Map<Integer, Long> hours) {
        Integer peak = null;
        var best = 0L;
        // Ascending iteration with a strict comparison keeps the earliest hour on ties
        for (final var entry : hours.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                peak = entry.getKey();
            }
        }
        return peak;
    }

    private static Map<DayOfWeek, Long> dayDistribution(List<PostRecord> sorted) {
        final var days = new EnumMap<DayOfWeek, Long>(DayOfWeek.class);
        for (final var post : sorted) {
            days.merge(post.timestamp().getDayOfWeek(), 1L, Long::sum);
        }
        return days;
    }

    private static Double averageIntervalHours(List<PostRecord> sorted) {
        if (sorted.size() < 2) {
            return null;
        }
        var totalNanos = 0.0;
        for (var i = 1; i < sorted.size(); i++) {
            final var gap = Duration.between(
                    sorted.get(i - 1).timestamp().toInstant(), sorted.get(i).timestamp().toInstant());
            totalNanos += gap.toNanos();
        }
        final var meanHours = totalNanos / (sorted.size() - 1) / NANOS_PER_HOUR;
        return Decimals.round(meanHours, 2);
    }

    private List<RankedCount> rank(List<PostRecord> sorted, Function<PostRecord, List<String>> values) {
        // Insertion order records first appearance
        final var counts = new LinkedHashMap<String, Long>();
        for (final var post : sorted) {
            for (final var value : values.apply(post)) {
                counts.merge(value, 1L, Long::sum);
            }
        }

        final var ranked = new ArrayList<RankedCount>(counts.size());
        counts.forEach((value, count) -> ranked.add(new RankedCount(value, count)));
        ranked.sort(Comparator.comparingLong(RankedCount::count).reversed());

        return List.copyOf(ranked.subList(0, Math.min(topN, ranked.size())));
    }

    private List<TopPost> topPosts(List<PostRecord> sorted) {
        final var ranked = new ArrayList<>(sorted);
        ranked.sort(Comparator.comparingLong(PostRecord::engagement).reversed());
        return ranked.stream().limit(topPosts).map(TopPost::from).toList();
    }
}
