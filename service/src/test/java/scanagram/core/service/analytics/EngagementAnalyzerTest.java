package scanagram.core.service.analytics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static scanagram.mock.TestData.post;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scanagram.core.model.report.RankedCount;
import scanagram.core.model.report.TopPost;

@DisplayName("EngagementAnalyzer")
class EngagementAnalyzerTest {

    private final EngagementAnalyzer analyzer = new EngagementAnalyzer(10, 5);

    @Nested
    @DisplayName("Empty input")
    class EmptyInputTests {

        @Test
        @DisplayName("should return a flagged report with zeroed statistics")
        void shouldReturnFlaggedReport() {
            final var report = analyzer.analyze(List.of(), 1000);

            assertTrue(report.empty());
            assertTrue(report.lowConfidence());
            assertEquals(0, report.sampleSize());
            assertEquals(0.0, report.avgLikes());
            assertEquals(0.0, report.avgComments());
            assertEquals(0.0, report.engagementRate());
            assertNull(report.peakPostingHour());
            assertNull(report.avgPostIntervalHours());
            assertTrue(report.hourDistribution().isEmpty());
            assertTrue(report.dayDistribution().isEmpty());
            assertTrue(report.topHashtags().isEmpty());
            assertTrue(report.topPosts().isEmpty());
        }
    }

    @Nested
    @DisplayName("Engagement")
    class EngagementTests {

        @Test
        @DisplayName("should compute the rate for a single post")
        void shouldComputeSinglePostRate() {
            final var report = analyzer.analyze(List.of(post("a", "2024-03-01T18:15:00Z", 100, 10)), 1000);

            assertFalse(report.empty());
            assertEquals(100.0, report.avgLikes());
            assertEquals(10.0, report.avgComments());
            assertEquals(11.0, report.engagementRate());
            assertFalse(report.lowConfidence());
            assertEquals(18, report.peakPostingHour());
            assertNull(report.avgPostIntervalHours());
        }

        @Test
        @DisplayName("should average over all posts")
        void shouldAverage() {
            final var report = analyzer.analyze(
                    List.of(post("a", "2024-03-01T10:00:00Z", 100, 10), post("b", "2024-03-02T10:00:00Z", 51, 5)),
                    3000);

            assertEquals(151, report.totalLikes());
            assertEquals(15, report.totalComments());
            assertEquals(75.5, report.avgLikes());
            assertEquals(7.5, report.avgComments());
            assertEquals(2.767, report.engagementRate());
        }

        @Test
        @DisplayName("should flag low confidence without followers")
        void shouldFlagMissingFollowers() {
            final var report = analyzer.analyze(List.of(post("a", "2024-03-01T18:15:00Z", 100, 10)), 0);

            assertTrue(report.lowConfidence());
            assertEquals(11000.0, report.engagementRate());
        }
    }

    @Nested
    @DisplayName("Temporal analysis")
    class TemporalTests {

        @Test
        @DisplayName("should give ties for the peak hour to the earliest hour")
        void shouldBreakPeakTiesByEarliestHour() {
            final var report = analyzer.analyze(
                    List.of(post("a", "2024-03-01T20:00:00Z", 1, 0), post("b", "2024-03-02T08:00:00Z", 1, 0)), 100);

            assertEquals(8, report.peakPostingHour());
            assertEquals(24, report.hourDistribution().size());
            assertEquals(1L, report.hourDistribution().get(20));
            assertEquals(0L, report.hourDistribution().get(12));
        }

        @Test
        @DisplayName("should use each post's own offset for the hour")
        void shouldUseOwnOffset() {
            final var report = analyzer.analyze(List.of(post("a", "2024-03-01T23:30:00+09:00", 1, 0)), 100);

            assertEquals(23, report.peakPostingHour());
            assertEquals(Map.of(DayOfWeek.FRIDAY, 1L), report.dayDistribution());
        }

        @Test
        @DisplayName("should average intervals after sorting chronologically")
        void shouldAverageIntervals() {
            final var report = analyzer.analyze(
                    List.of(
                            post("c", "2024-03-01T18:00:00Z", 1, 0),
                            post("a", "2024-03-01T00:00:00Z", 1, 0),
                            post("b", "2024-03-01T06:00:00Z", 1, 0)),
                    100);

            assertEquals(9.0, report.avgPostIntervalHours());
        }
    }

    @Nested
    @DisplayName("Rankings")
    class RankingTests {

        @Test
        @DisplayName("should rank hashtags by count with ties in first-seen order")
        void shouldRankHashtags() {
            final var report = analyzer.analyze(
                    List.of(
                            post("c", "2024-03-03T10:00:00Z", 1, 0, Set.of("c"), null),
                            post("a", "2024-03-01T10:00:00Z", 1, 0, orderedSet("b", "a"), null),
                            post("b", "2024-03-02T10:00:00Z", 1, 0, orderedSet("a", "c"), null)),
                    100);

            assertEquals(
                    List.of(new RankedCount("a", 2), new RankedCount("c", 2), new RankedCount("b", 1)),
                    report.topHashtags());
        }

        @Test
        @DisplayName("should keep only the top entries")
        void shouldLimitRankings() {
            final var limited = new EngagementAnalyzer(1, 1);
            final var report = limited.analyze(
                    List.of(
                            post("a", "2024-03-01T10:00:00Z", 5, 0, Set.of("x"), "Berlin"),
                            post("b", "2024-03-02T10:00:00Z", 9, 0, Set.of("y"), "Berlin"),
                            post("c", "2024-03-03T10:00:00Z", 1, 0, Set.of("y"), "Paris")),
                    100);

            assertEquals(List.of(new RankedCount("y", 2)), report.topHashtags());
            assertEquals(List.of(new RankedCount("Berlin", 2)), report.topLocations());
            assertEquals(1, report.topPosts().size());
            assertEquals("b", report.topPosts().get(0).shortcode());
        }

        @Test
        @DisplayName("should order top posts by engagement with ties in chronological order")
        void shouldRankTopPosts() {
            final var report = analyzer.analyze(
                    List.of(
                            post("late", "2024-03-03T10:00:00Z", 10, 0),
                            post("best", "2024-03-02T10:00:00Z", 50, 5),
                            post("early", "2024-03-01T10:00:00Z", 8, 2)),
                    100);

            assertEquals(
                    List.of("best", "early", "late"),
                    report.topPosts().stream().map(TopPost::shortcode).toList());
        }
    }

    @Test
    @DisplayName("should produce equal reports for the same posts in any order")
    void shouldBeDeterministic() {
        final var posts = new ArrayList<>(List.of(
                post("a", "2024-03-01T10:00:00Z", 10, 1, Set.of("x", "y"), "Rome"),
                post("b", "2024-03-02T12:00:00Z", 20, 2, Set.of("y"), null),
                post("c", "2024-03-04T09:30:00+01:00", 30, 3, Set.of("z"), "Rome")));

        final var first = analyzer.analyze(posts, 500);
        Collections.reverse(posts);
        final var second = analyzer.analyze(posts, 500);

        assertEquals(first, second);
        assertEquals(first, analyzer.analyze(posts, 500));
    }

    private static Set<String> orderedSet(String... values) {
        return new LinkedHashSet<>(List.of(values));
    }
}
