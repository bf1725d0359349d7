package scanagram.core.model.report;

import java.util.List;

import scanagram.core.model.profile.PostRecord;
import scanagram.core.model.profile.ProfileMetadata;

/**
 * Everything collected and derived for one profile.
 */
public record ProfileReport(
        String username,
        ProfileMetadata profile,
        List<PostRecord> posts,
        EngagementReport engagement,
        ProfileIndicators indicators,
        CollectionSummary collection) {

    public ProfileReport {
        posts = posts == null ? List.of() : List.copyOf(posts);
    }
}
