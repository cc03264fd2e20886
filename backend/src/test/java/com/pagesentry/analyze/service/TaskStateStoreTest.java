package com.pagesentry.analyze.service;

import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.config.AnalyzerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStateStoreTest {
    private TaskStateStore store;

    @BeforeEach
    void setUp() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getBatch().setMaxSnippets(2);
        store = new TaskStateStore(properties);
    }

    @Test
    void accumulatesAcrossBatchesUntilFinished() {
        assertThat(store.begin("t1", "https://a.example", 1)).isNull();
        assertThat(store.claimPage("t1", "https://a.example/1")).isTrue();
        store.fold("t1", "https://a.example/1", List.of(candidate("weed", "narcotics", "buy weed")));

        assertThat(store.begin("t1", "https://a.example", 2)).isNull();
        assertThat(store.claimPage("t1", "https://a.example/2")).isTrue();
        store.fold("t1", "https://a.example/2", List.of(candidate("upi", "payments", "pay by upi")));

        BatchAccumulator.Snapshot snapshot = store.finish("t1");
        assertThat(snapshot.totalPages()).isEqualTo(2);
        assertThat(snapshot.totalMatches()).isEqualTo(2);
        assertThat(snapshot.categories()).containsExactly("narcotics", "payments");
        assertThat(snapshot.lastBatchNum()).isEqualTo(2);
        assertThat(store.activeTasks()).isZero();
        assertThat(store.finish("t1")).isNull();
    }

    @Test
    void firstBatchDiscardsEarlierStateForSameTask() {
        store.begin("t1", "https://a.example", 1);
        store.claimPage("t1", "https://a.example/1");
        store.fold("t1", "https://a.example/1", List.of(candidate("weed", "narcotics", "buy weed")));

        BatchAccumulator.Snapshot discarded = store.begin("t1", "https://a.example", 1);

        assertThat(discarded).isNotNull();
        assertThat(discarded.subUrls()).containsExactly("https://a.example/1");
        assertThat(store.snapshot("t1").totalPages()).isZero();
        assertThat(store.claimPage("t1", "https://a.example/1")).isTrue();
    }

    @Test
    void pageUrlIsClaimedOncePerTask() {
        store.begin("t1", "https://a.example", 1);
        store.begin("t2", "https://b.example", 1);

        assertThat(store.claimPage("t1", "https://a.example/x")).isTrue();
        assertThat(store.claimPage("t1", "https://a.example/x")).isFalse();
        assertThat(store.claimPage("t2", "https://a.example/x")).isTrue();
        assertThat(store.claimPage("missing", "https://a.example/x")).isFalse();
    }

    @Test
    void duplicateCandidatesOnSamePageAreCountedOnce() {
        store.begin("t1", "https://a.example", 1);
        MatchCandidate weed = candidate("weed", "narcotics", "buy weed");

        assertThat(store.fold("t1", "https://a.example/1", List.of(weed, weed))).isEqualTo(1);
        assertThat(store.fold("t1", "https://a.example/1", List.of(weed))).isZero();
        assertThat(store.fold("t1", "https://a.example/2", List.of(weed))).isEqualTo(1);
        assertThat(store.snapshot("t1").totalMatches()).isEqualTo(2);
    }

    @Test
    void snippetsAreCappedButMatchesStillCounted() {
        store.begin("t1", "https://a.example", 1);
        store.fold("t1", "https://a.example/1", List.of(
            candidate("weed", "narcotics", "one"),
            candidate("weed", "narcotics", "two"),
            candidate("weed", "narcotics", "three")
        ));

        BatchAccumulator.Snapshot snapshot = store.snapshot("t1");
        assertThat(snapshot.snippets()).containsExactly("one", "two");
        assertThat(snapshot.totalMatches()).isEqualTo(3);
        assertThat(snapshot.keywords()).hasSize(3);
    }

    @Test
    void foldWithoutOpenTaskIsIgnored() {
        assertThat(store.fold("nobody", "https://a.example/1", List.of(candidate("weed", "narcotics", "x")))).isZero();
        assertThat(store.snapshot("nobody")).isNull();
    }

    private static MatchCandidate candidate(String term, String category, String snippet) {
        return new MatchCandidate(term, category, snippet, MatchSource.REGEX, 1.0);
    }
}
