package com.mediaanalytics.etl.transform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives content fields from a page URL such as {@code https://news.example.com/sports/article-42}.
 */
public final class UrlFieldExtractor {
    public static final String UNKNOWN = "unknown";

    private static final Pattern CATEGORY = Pattern.compile("news\\.example\\.com/([^/]+)");
    private static final Pattern ARTICLE_ID = Pattern.compile("article-(\\d+)");

    private UrlFieldExtractor() {
    }

    /**
     * Path segment right after {@code news.example.com/}, or {@value #UNKNOWN}.
     */
    public static String contentCategory(String pageUrl) {
        return firstGroup(CATEGORY, pageUrl);
    }

    /**
     * Digits after the first {@code article-} in the URL, or {@value #UNKNOWN}.
     */
    public static String articleId(String pageUrl) {
        return firstGroup(ARTICLE_ID, pageUrl);
    }

    private static String firstGroup(Pattern pattern, String input) {
        if (input == null) {
            return UNKNOWN;
        }
        Matcher matcher = pattern.matcher(input);
        return matcher.find() ? matcher.group(1) : UNKNOWN;
    }
}
