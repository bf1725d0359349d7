package scanagram.core.model.report;

import scanagram.core.model.profile.PostRecord;

/**
 * A post ranked by engagement (likes plus comments).
 */
public record TopPost(String shortcode, String url, long likes, long comments, long engagement) {

    public static TopPost from(PostRecord post) {
        return new TopPost(post.shortcode(), post.url(), post.likes(), post.comments(), post.engagement());
    }
}
