package com.mediaanalytics.etl.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferrerClassifierTest {

    @Test
    void testDirectWhenEmptyOrMissing() {
        assertThat(ReferrerClassifier.classify("")).isEqualTo("direct");
        assertThat(ReferrerClassifier.classify(null)).isEqualTo("direct");
    }

    @Test
    void testKnownSources() {
        assertThat(ReferrerClassifier.classify("https://www.google.com/search")).isEqualTo("search");
        assertThat(ReferrerClassifier.classify("https://facebook.com")).isEqualTo("social");
        assertThat(ReferrerClassifier.classify("https://t.co/twitter")).isEqualTo("social");
        assertThat(ReferrerClassifier.classify("https://www.nytimes.com/section")).isEqualTo("news");
        assertThat(ReferrerClassifier.classify("https://email.example.com/campaign")).isEqualTo("email");
        assertThat(ReferrerClassifier.classify("https://random.biz")).isEqualTo("other");
    }

    @Test
    void testFirstMatchingRuleWins() {
        // "newsletter" also contains "news", which is checked first
        assertThat(ReferrerClassifier.classify("https://mail.example.com/newsletter")).isEqualTo("news");
        assertThat(ReferrerClassifier.classify("https://google.com/?q=facebook")).isEqualTo("search");
    }

    @Test
    void testMatchingIsCaseSensitive() {
        // callers lower-case the referrer first
        assertThat(ReferrerClassifier.classify("https://www.GOOGLE.com")).isEqualTo("other");
    }
}
