package com.portfolio.analytics.pulse.util;

import com.portfolio.analytics.pulse.util.CommentScanner.KeywordMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CommentScannerTest {

    @Test
    void firstMatch_returnsContextStartingAtKeyword() {
        Optional<KeywordMatch> match = CommentScanner.firstMatch(
                "Blocked by vendor contract. Chasing legal.", List.of("blocked by", "waiting for"));

        assertThat(match).isPresent();
        assertThat(match.get().getKeyword()).isEqualTo("blocked by");
        assertThat(match.get().getContext()).isEqualTo("Blocked by vendor contract");
    }

    @Test
    void firstMatch_returnsEmpty_whenTextIsBlank() {
        assertThat(CommentScanner.firstMatch("   ", List.of("blocked by"))).isEmpty();
        assertThat(CommentScanner.firstMatch(null, List.of("blocked by"))).isEmpty();
    }

    @Test
    void findAll_returnsMatchesInTextOrder() {
        List<KeywordMatch> matches = CommentScanner.findAll(
                "Needs sign-off; depends on: the data team", List.of("depends on", "needs"));

        assertThat(matches).extracting(KeywordMatch::getKeyword).containsExactly("needs", "depends on");
        assertThat(matches.get(0).getContext()).isEqualTo("sign-off");
        assertThat(matches.get(1).getContext()).isEqualTo("the data team");
    }

    @Test
    void findAll_prefersLongerKeyword_whenTwoStartAtSameOffset() {
        List<KeywordMatch> matches = CommentScanner.findAll(
                "on hold pending budget", List.of("on hold", "on hold pending"));

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getKeyword()).isEqualTo("on hold pending");
    }

    @Test
    void contextAfter_truncatesLongText() {
        String text = "x".repeat(200);

        assertThat(CommentScanner.contextAfter(text, 0)).hasSize(CommentScanner.CONTEXT_LIMIT);
    }

    @Test
    void stripLeadingNoise_removesPunctuationAndWhitespace() {
        assertThat(CommentScanner.stripLeadingNoise(" :- Alpha")).isEqualTo("Alpha");
    }
}
