package scanagram.adapter.out.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import scanagram.core.model.report.EngagementReport;
import scanagram.core.model.report.ExportFormat;
import scanagram.core.model.report.ProfileReport;
import scanagram.core.model.report.RankedCount;
import scanagram.core.port.out.ReportWriter;

/**
 * Writes reports as a human-readable Markdown document.
 */
@ApplicationScoped
public class MarkdownReportWriter implements ReportWriter {

    static final String DISCLAIMER =
            "This report contains publicly available information only. Respect the privacy of the"
                    + " profile owner and the terms of service of the platform.";

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public void write(ProfileReport report, Path target) throws IOException {
        Files.writeString(target, render(report), StandardCharsets.UTF_8);
    }

    String render(ProfileReport report) {
        final var md = new StringBuilder();
        final var profile = report.profile();
        final var engagement = report.engagement();

        md.append("# Profile Report: @").append(report.username()).append("\n\n");
        md.append("Generated: ")
                .append(DateTimeFormatter.ISO_INSTANT.format(report.collection().generatedAt()))
                .append("\n\n");

        md.append("## Profile\n\n");
        row(md, "Full name", profile.fullName());
        row(md, "Biography", profile.biography().replace('\n', ' '));
        row(md, "External URL", profile.externalUrl());
        row(md, "Followers", String.valueOf(profile.followers()));
        row(md, "Following", String.valueOf(profile.following()));
        row(md, "Posts", String.valueOf(profile.postsCount()));
        row(md, "Private", yesNo(profile.privateProfile()));
        row(md, "Verified", yesNo(profile.verified()));
        row(md, "Business account", yesNo(profile.business()));
        if (profile.businessCategory() != null) {
            row(md, "Business category", profile.businessCategory());
        }
        row(md, "Follower/following ratio", String.valueOf(report.indicators().followerFollowingRatio()));
        md.append('\n');

        md.append("## Engagement Statistics\n\n");
        if (engagement.empty()) {
            md.append("No posts were analyzed.\n\n");
        } else {
            row(md, "Posts analyzed", String.valueOf(engagement.sampleSize()));
            row(md, "Total likes", String.valueOf(engagement.totalLikes()));
            row(md, "Total comments", String.valueOf(engagement.totalComments()));
            row(md, "Average likes", String.valueOf(engagement.avgLikes()));
            row(md, "Average comments", String.valueOf(engagement.avgComments()));
            row(md, "Engagement rate", engagement.engagementRate() + "%"
                    + (engagement.lowConfidence() ? " (low confidence)" : ""));
            md.append('\n');
        }

        md.append("## Top Posts\n\n");
        if (engagement.topPosts().isEmpty()) {
            md.append("None.\n\n");
        } else {
            var rank = 1;
            for (final var post : engagement.topPosts()) {
                md.append(rank++)
                        .append(". ")
                        .append(post.url() != null ? "[" + post.shortcode() + "](" + post.url() + ")" : post.shortcode())
                        .append(" - ")
                        .append(post.likes())
                        .append(" likes, ")
                        .append(post.comments())
                        .append(" comments\n");
            }
            md.append('\n');
        }

        md.append("## Temporal Analysis\n\n");
        temporal(md, engagement);

        md.append("## Top Hashtags\n\n");
        ranking(md, engagement.topHashtags(), "#");

        md.append("## Top Locations\n\n");
        ranking(md, engagement.topLocations(), "");

        final var collection = report.collection();
        md.append("## Collection Metadata\n\n");
        row(md, "Duration", collection.duration().toString());
        row(md, "Posts analyzed", collection.postsAnalyzed() + " of at most " + collection.maxPosts());
        row(md, "Truncated", yesNo(collection.truncated()));
        row(md, "Posts skipped (private)", yesNo(collection.skippedPrivate()));
        if (collection.rateLimit() != null) {
            final var limiter = collection.rateLimit();
            row(md, "Requests issued", String.valueOf(limiter.totalIssued()));
            row(md, "Requests in window", limiter.inWindow() + " / " + limiter.limit());
            row(md, "Window utilization", limiter.utilizationPercent() + "%");
        }
        md.append('\n');

        md.append("---\n\n").append("_").append(DISCLAIMER).append("_\n");
        return md.toString();
    }

    private static void temporal(StringBuilder md, EngagementReport engagement) {
        if (engagement.peakPostingHour() == null) {
            md.append("Not enough posts.\n\n");
            return;
        }
        row(md, "Peak posting hour", "%02d:00".formatted(engagement.peakPostingHour()));
        if (engagement.avgPostIntervalHours() != null) {
            row(md, "Average interval between posts", engagement.avgPostIntervalHours() + " hours");
        }
        md.append('\n');

        md.append("| Day | Posts |\n|---|---|\n");
        for (final var day : engagement.dayDistribution().entrySet()) {
            md.append("| ")
                    .append(day.getKey().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                    .append(" | ")
                    .append(day.getValue())
                    .append(" |\n");
        }
        md.append('\n');
    }

    private static void ranking(StringBuilder md, List<RankedCount> entries, String prefix) {
        if (entries.isEmpty()) {
            md.append("None.\n\n");
            return;
        }
        for (final var entry : entries) {
            md.append("- ")
                    .append(prefix)
                    .append(entry.value())
                    .append(" (")
                    .append(entry.count())
                    .append(")\n");
        }
        md.append('\n');
    }

    private static void row(StringBuilder md, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        md.append("- **").append(label).append(":** ").append(value).append('\n');
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
