package scanagram.core.service.collection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scanagram.core.config.CollectionConfig;
import scanagram.core.model.governor.GovernorResult;
import scanagram.core.model.profile.PostPage;
import scanagram.core.model.profile.PostRecord;
import scanagram.core.model.profile.ProfileCollectionException;
import scanagram.core.model.profile.ProfileCollectionException.Stage;
import scanagram.core.model.profile.ProfileMetadata;
import scanagram.core.model.ratelimit.LimiterSnapshot;
import scanagram.core.model.report.CollectionSummary;
import scanagram.core.model.report.ProfileIndicators;
import scanagram.core.model.report.ProfileReport;
import scanagram.core.port.in.ProfileReporting;
import scanagram.core.port.out.ProfileSource;
import scanagram.core.port.out.TimeSource;
import scanagram.core.service.analytics.EngagementAnalyzer;
import scanagram.core.service.governor.GovernorRegistry;
import scanagram.core.service.governor.RequestGovernor;
import scanagram.core.util.Decimals;

/**
 * Collects a profile and its recent posts and turns them into a report.
 *
 * <p>
 * Every remote call goes through the profile's {@link RequestGovernor}. The
 * profile fetch is mandatory. Post pages are fetched until {@code maxPosts}
 * posts are collected or the listing ends; if a page after the first fails,
 * the posts collected so far are analyzed and the report is marked truncated.
 * Posts of private profiles are not requested.
 */
@ApplicationScoped
public class ProfileCollector implements ProfileReporting {

    private static final Logger LOG = Logger.getLogger(ProfileCollector.class);

    static final String FETCH_PROFILE = "fetch-profile";
    static final String FETCH_POSTS = "fetch-posts";

    private final ProfileSource source;
    private final GovernorRegistry governors;
    private final EngagementAnalyzer analyzer;
    private final CollectionConfig config;
    private final TimeSource timeSource;

    public ProfileCollector(
            ProfileSource source,
            GovernorRegistry governors,
            EngagementAnalyzer analyzer,
            CollectionConfig config,
            TimeSource timeSource) {
        this.source = source;
        this.governors = governors;
        this.analyzer = analyzer;
        this.config = config;
        this.timeSource = timeSource;
    }

    @Override
    public Uni<ProfileReport> collect(String username) {
        return Uni.createFrom().deferred(() -> {
            final var governor = governors.forProfile(username);
            final var key = governor.key();
            final var startedNanos = timeSource.monotonicNanos();

            LOG.infof("Collecting profile %s", key);
            return governor.execute(FETCH_PROFILE, () -> source.fetchProfile(key))
                    .map(result -> requireProfile(governor, result))
                    .chain(profile -> collectPosts(governor, profile)
                            .map(posts -> assemble(governor, profile, posts, startedNanos)));
        });
    }

    @Override
    public LimiterSnapshot limiterStatus(String username) {
        return governors.forProfile(username).limiter().snapshot(timeSource.monotonicNanos());
    }

    private ProfileMetadata requireProfile(RequestGovernor governor, GovernorResult<ProfileMetadata> result) {
        if (result instanceof GovernorResult.Success<ProfileMetadata> success) {
            return success.value();
        }
        throw new ProfileCollectionException(governor.key(), Stage.PROFILE, result, governor.suggestedRetryAfter());
    }

    private Uni<CollectedPosts> collectPosts(RequestGovernor governor, ProfileMetadata profile) {
        if (profile.privateProfile()) {
            LOG.infof("Profile %s is private, skipping posts", governor.key());
            return Uni.createFrom().item(new CollectedPosts(List.of(), false, true));
        }
        if (config.maxPosts() <= 0) {
            return Uni.createFrom().item(new CollectedPosts(List.of(), false, false));
        }
        return nextPage(governor, List.of(), null);
    }

    private Uni<CollectedPosts> nextPage(RequestGovernor governor, List<PostRecord> collected, String cursor) {
        final var remaining = config.maxPosts() - collected.size();
        final var limit = Math.max(1, Math.min(config.pageSize(), remaining));

        return governor.execute(FETCH_POSTS, () -> source.fetchPostPage(governor.key(), cursor, limit))
                .chain(result -> {
                    if (!(result instanceof GovernorResult.Success<PostPage> success)) {
                        if (cursor == null) {
                            throw new ProfileCollectionException(
                                    governor.key(), Stage.POSTS, result, governor.suggestedRetryAfter());
                        }
                        LOG.warnf(
                                "Stopped paging posts of %s after %d post(s): %s",
                                governor.key(), collected.size(), result.state());
                        return Uni.createFrom().item(new CollectedPosts(collected, true, false));
                    }

                    final var page = success.value();
                    final var take = Math.min(remaining, page.posts().size());
                    final var merged = new ArrayList<PostRecord>(collected.size() + take);
                    merged.addAll(collected);
                    merged.addAll(page.posts().subList(0, take));
                    final var upToPage = List.copyOf(merged);

                    if (upToPage.size() >= config.maxPosts() || !page.hasNext() || page.posts().isEmpty()) {
                        return Uni.createFrom().item(new CollectedPosts(upToPage, false, false));
                    }
                    return nextPage(governor, upToPage, page.nextCursor().get());
                });
    }

    private ProfileReport assemble(
            RequestGovernor governor, ProfileMetadata profile, CollectedPosts posts, long startedNanos) {
        final var engagement = analyzer.analyze(posts.posts(), profile.followers());
        final var indicators = new ProfileIndicators(
                profile.privateProfile(),
                profile.verified(),
                Decimals.round((double) profile.followers() / Math.max(profile.following(), 1L), 2),
                engagement.engagementRate());

        final var nowNanos = timeSource.monotonicNanos();
        final var summary = new CollectionSummary(
                timeSource.now(),
                Duration.ofNanos(Math.max(0L, nowNanos - startedNanos)),
                posts.posts().size(),
                config.maxPosts(),
                posts.truncated(),
                posts.skippedPrivate(),
                governor.limiter().snapshot(nowNanos));

        LOG.infof(
                "Collected %s: %d post(s), engagement rate %.3f%%%s",
                governor.key(),
                posts.posts().size(),
                engagement.engagementRate(),
                posts.truncated() ? " (truncated)" : "");
        return new ProfileReport(governor.key(), profile, posts.posts(), engagement, indicators, summary);
    }

    private record CollectedPosts(List<PostRecord> posts, boolean truncated, boolean skippedPrivate) {}
}
