package scanagram.core.util;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts hashtags from post captions.
 */
public final class HashtagExtractor {

    private static final Pattern HASHTAG = Pattern.compile("#(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);

    private HashtagExtractor() {}

    /**
     * Hashtags in the order they first appear, without the leading {@code #}.
     * Duplicates are dropped; case is kept.
     *
     * @param caption the caption, may be null
     * @return the hashtags, empty when there are none
     */
    public static Set<String> extract(String caption) {
        final var tags = new LinkedHashSet<String>();
        if (caption == null || caption.isEmpty()) {
            return tags;
        }
        final var matcher = HASHTAG.matcher(caption);
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        return tags;
    }
}
