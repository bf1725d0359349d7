package scanagram.core.model.report;

/**
 * Headline indicators derived from profile metadata and engagement.
 *
 * @param privateProfile         whether the profile is private
 * @param verified               whether the profile is verified
 * @param followerFollowingRatio followers / max(following, 1), two decimals
 * @param engagementRate         engagement rate of the analyzed posts
 */
public record ProfileIndicators(
        boolean privateProfile, boolean verified, double followerFollowingRatio, double engagementRate) {}
