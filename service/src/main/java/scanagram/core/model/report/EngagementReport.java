package scanagram.core.model.report;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engagement and temporal statistics of one analysis run.
 *
 * <p>Nullable fields are {@code null} when the sample is too small to define them.
 *
 * @param sampleSize           number of posts analyzed
 * @param empty                whether no posts were analyzed
 * @param totalLikes           sum of likes
 * @param totalComments        sum of comments
 * @param avgLikes             mean likes per post (0 when empty)
 * @param avgComments          mean comments per post (0 when empty)
 * @param engagementRate       (avgLikes + avgComments) / followers * 100, three decimals
 * @param lowConfidence        whether the rate rests on an empty sample or an unknown audience
 * @param peakPostingHour      most frequent posting hour 0-23, earliest on ties; null when empty
 * @param hourDistribution     post count for every hour 0-23
 * @param dayDistribution      post count per day of week, for days that occur
 * @param avgPostIntervalHours mean gap between consecutive posts; null below two posts
 * @param topHashtags          most used hashtags
 * @param topLocations         most used locations
 * @param topPosts             posts with the highest engagement
 */
public record EngagementReport(
        int sampleSize,
        boolean empty,
        long totalLikes,
        long totalComments,
        double avgLikes,
        double avgComments,
        double engagementRate,
        boolean lowConfidence,
        Integer peakPostingHour,
        Map<Integer, Long> hourDistribution,
        Map<DayOfWeek, Long> dayDistribution,
        Double avgPostIntervalHours,
        List<RankedCount> topHashtags,
        List<RankedCount> topLocations,
        List<TopPost> topPosts) {

    public EngagementReport {
        hourDistribution = hourDistribution == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hourDistribution));
        dayDistribution = dayDistribution == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dayDistribution));
        topHashtags = topHashtags == null ? List.of() : List.copyOf(topHashtags);
        topLocations = topLocations == null ? List.of() : List.copyOf(topLocations);
        topPosts = topPosts == null ? List.of() : List.copyOf(topPosts);
    }
}
