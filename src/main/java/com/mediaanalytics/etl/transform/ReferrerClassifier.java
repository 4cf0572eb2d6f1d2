package com.mediaanalytics.etl.transform;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Coarse traffic-source classification of a referrer string. Rules are checked in order; first match wins.
 */
public final class ReferrerClassifier {
    public static final String DIRECT = "direct";
    public static final String SEARCH = "search";
    public static final String SOCIAL = "social";
    public static final String NEWS = "news";
    public static final String EMAIL = "email";
    public static final String OTHER = "other";

    private static final List<Rule> RULES = Collections.unmodifiableList(Arrays.asList(
        new Rule(SEARCH, "google"),
        new Rule(SOCIAL, "facebook", "twitter", "instagram", "social"),
        new Rule(NEWS, "news", "nytimes", "cnn"),
        new Rule(EMAIL, "email", "newsletter")));

    private ReferrerClassifier() {
    }

    /**
     * Classify an already lower-cased referrer. Matching is a case-sensitive substring test.
     */
    public static String classify(String referrer) {
        if (referrer == null || referrer.isEmpty()) {
            return DIRECT;
        }
        for (Rule rule : RULES) {
            if (rule.matches(referrer)) {
                return rule.category;
            }
        }
        return OTHER;
    }

    private static final class Rule {
        private final String category;
        private final String[] needles;

        Rule(String category, String... needles) {
            this.category = category;
            this.needles = needles;
        }

        boolean matches(String referrer) {
            for (String needle : needles) {
                if (referrer.contains(needle)) {
                    return true;
                }
            }
            return false;
        }
    }
}
