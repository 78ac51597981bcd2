package com.ddosshield.core.pipeline;

import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.SourceIdentity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ddosshield.core.TestFixtures.T0;
import static com.ddosshield.core.TestFixtures.verdict;
import static org.assertj.core.api.Assertions.assertThat;

class VerdictHistoryTest {

    private static final SourceIdentity A = SourceIdentity.of("192.0.2.1");
    private static final SourceIdentity B = SourceIdentity.of("192.0.2.2");
    private static final SourceIdentity C = SourceIdentity.of("192.0.2.3");

    @Test
    @DisplayName("Keeps the most recent verdicts per source, oldest first")
    void shouldKeepMostRecent() {
        VerdictHistory history = new VerdictHistory(2, 10);

        history.record(verdict(A, 0.1, T0.plusSeconds(10)));
        history.record(verdict(A, 0.2, T0.plusSeconds(20)));
        history.record(verdict(A, 0.3, T0.plusSeconds(30)));

        assertThat(history.recent(A)).extracting(FusedVerdict::getScore).containsExactly(0.2, 0.3);
        assertThat(history.recent(B)).isEmpty();
    }

    @Test
    @DisplayName("Drops the least recently active source beyond the source limit")
    void shouldBoundSources() {
        VerdictHistory history = new VerdictHistory(2, 2);

        history.record(verdict(A, 0.1, T0.plusSeconds(10)));
        history.record(verdict(B, 0.1, T0.plusSeconds(10)));
        history.record(verdict(C, 0.1, T0.plusSeconds(10)));

        assertThat(history.recent(A)).isEmpty();
        assertThat(history.recent(C)).hasSize(1);
    }

    @Test
    @DisplayName("Forgetting a source drops its history")
    void shouldForget() {
        VerdictHistory history = new VerdictHistory(2, 2);
        history.record(verdict(A, 0.1, T0.plusSeconds(10)));

        history.forget(A);

        assertThat(history.recent(A)).isEmpty();
    }
}
