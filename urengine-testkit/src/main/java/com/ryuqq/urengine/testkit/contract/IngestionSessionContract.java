package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.IngestSession;
import com.ryuqq.urengine.core.ingest.IngestTask;
import com.ryuqq.urengine.core.ingest.IngestionSummary;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.ingest.PathEntryStatus;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.rule.PathMatchRule;
import com.ryuqq.urengine.core.rule.PathRewriteRule;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.core.statemachine.IngestSessionState;
import com.ryuqq.urengine.core.statemachine.PathEntryState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract for the ingestion flow over {@link com.ryuqq.urengine.core.spi.IngestSessionStore}
 * and {@link com.ryuqq.urengine.core.spi.ResourceStore} implementations.
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>A three-file tree ingested twice admits once and reports duplicates the second time</li>
 *   <li>Rule priority, strict namespaces, path globs and rewrites decide entry outcomes</li>
 *   <li>Adapter failures become ERRORED entries and observer issues</li>
 *   <li>Closed sessions reject new paths and a second close</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class IngestionSessionContract extends AbstractEngineContractTest {

    private static final List<String> TREE = List.of("a.md", "b.md", "sub/c.txt");

    protected DeviceId d1;

    @BeforeEach
    protected void setUpTree() {
        d1 = registerDevice("D1");
        adapter.put("/d1/a.md", "# A")
            .put("/d1/b.md", "# B")
            .put("/d1/sub/c.txt", "c");
    }

    private IngestionSummary ingestTree(BehaviorConfig behavior) {
        IngestSessionId session = manager.open(d1, null, behavior);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);
        for (String rel : TREE) {
            manager.recordEntry(pathId, "/d1/" + rel, rel);
        }
        return manager.close(session);
    }

    // ============================================================
    // 1. End-to-end
    // ============================================================

    @Test
    void ingest_같은_트리를_두번_수집하면_두번째는_모두_중복() {
        // when
        IngestionSummary run1 = ingestTree(new BehaviorConfig());
        clock.advance(Duration.ofMinutes(10));
        IngestionSummary run2 = ingestTree(new BehaviorConfig());

        // then
        assertThat(run1).isEqualTo(new IngestionSummary(3, 0, 0, 0));
        assertThat(run2).isEqualTo(new IngestionSummary(0, 3, 0, 0));
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(3);
        assertThat(fixture.ingestSessions().sessionsOf(d1)).hasSize(2);
    }

    @Test
    void ingest_중복_엔트리는_최초_리소스를_가리킴() {
        // given
        ingestTree(new BehaviorConfig());
        IngestSessionId firstSession = fixture.ingestSessions().sessionsOf(d1).get(0).id();
        clock.advance(Duration.ofMinutes(10));

        // when
        ingestTree(new BehaviorConfig());
        IngestSessionId secondSession = fixture.ingestSessions().sessionsOf(d1).get(1).id();

        // then
        List<PathEntry> first = fixture.ingestSessions().entriesOf(firstSession);
        List<PathEntry> second = fixture.ingestSessions().entriesOf(secondSession);
        assertThat(second).extracting(PathEntry::status).containsOnly(PathEntryStatus.DUPLICATE);
        assertThat(second).extracting(PathEntry::resourceId)
            .containsExactlyInAnyOrderElementsOf(first.stream().map(PathEntry::resourceId).toList());
        second.forEach(entry -> assertThat(fixture.resources().find(entry.resourceId()).orElseThrow()
            .ingestSessionId()).isEqualTo(firstSession));
    }

    @Test
    void recordEntry_엔트리는_경로_파생_필드와_최종_상태를_가짐() {
        // given
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);

        // when
        PathEntry entry = manager.recordEntry(pathId, "/d1/sub/c.txt", "sub/c.txt");

        // then
        assertThat(entry.status()).isEqualTo(PathEntryStatus.ADMITTED);
        assertThat(entry.state()).isEqualTo(PathEntryState.ADMITTED);
        assertThat(entry.relParent()).isEqualTo("sub");
        assertThat(entry.basename()).isEqualTo("c.txt");
        assertThat(entry.extension()).isEqualTo("txt");
        assertThat(entry.resourceId()).isNotNull();
    }

    @Test
    void recordEntry_같은_키로_다시_기록하면_기존_엔트리를_반환하고_집계는_그대로() {
        // given
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);
        PathEntry first = manager.recordEntry(pathId, "/d1/a.md", "a.md");

        // when
        PathEntry second = manager.recordEntry(pathId, "/d1/a.md", "a.md");

        // then
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(adapter.calls()).isEqualTo(1);
        assertThat(manager.summary(session)).isEqualTo(new IngestionSummary(1, 0, 0, 0));
    }

    @Test
    void recordEntry_동시에_같은_경로를_기록해도_엔트리는_하나() throws Exception {
        // given
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        Set<Object> entryIds = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        // when
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    entryIds.add(manager.recordEntry(pathId, "/d1/a.md", "a.md").id());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        assertThat(entryIds).hasSize(1);
        assertThat(fixture.ingestSessions().entriesOf(session)).hasSize(1);
        assertThat(manager.summary(session).total()).isEqualTo(1);
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(1);
    }

    @Test
    void recordEntry_여러_경로를_스레드마다_동시에_기록해도_각_경로는_ADMITTED_한번() throws Exception {
        // given
        List<String> rels = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String rel = "burst/f" + i + ".md";
            adapter.put("/d1/" + rel, "# F" + i);
            rels.add(rel);
        }
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        // when
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (String rel : rels) {
                        PathEntry entry = manager.recordEntry(pathId, "/d1/" + rel, rel);
                        assertThat(entry.status()).isEqualTo(PathEntryStatus.ADMITTED);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        assertThat(fixture.ingestSessions().entriesOf(session))
            .hasSize(rels.size())
            .extracting(PathEntry::status)
            .containsOnly(PathEntryStatus.ADMITTED);
        assertThat(manager.summary(session)).isEqualTo(new IngestionSummary(rels.size(), 0, 0, 0));
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(rels.size());
    }

    // ============================================================
    // 2. 규칙
    // ============================================================

    @Test
    void recordEntry_여러_규칙이_맞으면_priority가_낮은_규칙이_적용됨() {
        // given
        rules.register(PathMatchRule.of("ns", "\\.txt$", "by-extension", 2));
        rules.register(PathMatchRule.of("ns", "^/a/", "by-folder", 1));
        adapter.put("/a/b.txt", "b");
        IngestSessionId session = manager.open(d1, null, new BehaviorConfig().withRuleNamespace("ns"));
        IngestPathId pathId = manager.registerPath(session, "/a", null, null);

        // when
        PathEntry entry = manager.recordEntry(pathId, "/a/b.txt", "b.txt");

        // then
        assertThat(fixture.resources().find(entry.resourceId()).orElseThrow().nature()).isEqualTo("by-folder");
    }

    @Test
    void recordEntry_strict_namespace에서_맞는_규칙이_없으면_UNMATCHED() {
        // given
        rules.register(PathMatchRule.of("strict", "\\.md$", "markdown", 1));
        rules.setStrict("strict", true);
        IngestSessionId session = manager.open(d1, null, new BehaviorConfig().withRuleNamespace("strict"));
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);

        // when
        PathEntry md = manager.recordEntry(pathId, "/d1/a.md", "a.md");
        PathEntry txt = manager.recordEntry(pathId, "/d1/sub/c.txt", "sub/c.txt");

        // then
        assertThat(md.status()).isEqualTo(PathEntryStatus.ADMITTED);
        assertThat(txt.status()).isEqualTo(PathEntryStatus.UNMATCHED);
        assertThat(txt.state()).isEqualTo(PathEntryState.REJECTED);
        assertThat(txt.resourceId()).isNull();
        assertThat(manager.close(session)).isEqualTo(new IngestionSummary(1, 0, 1, 0));
    }

    @Test
    void recordEntry_경로_exclude_glob에_걸리면_EXCLUDED이고_어댑터를_호출하지_않음() {
        // given
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, List.of("*.txt"));

        // when
        PathEntry entry = manager.recordEntry(pathId, "/d1/sub/c.txt", "sub/c.txt");

        // then
        assertThat(entry.status()).isEqualTo(PathEntryStatus.EXCLUDED);
        assertThat(adapter.calls()).isZero();
    }

    @Test
    void recordEntry_rewrite_규칙이_있으면_정규화된_URI로_저장됨() {
        // given
        rules.register(PathRewriteRule.of("rw", "^/d1/(.*)$", "repo://d1/$1", 1));
        IngestSessionId session = manager.open(d1, null, new BehaviorConfig().withRuleNamespace("rw"));
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);

        // when
        PathEntry entry = manager.recordEntry(pathId, "/d1/a.md", "a.md");

        // then
        assertThat(fixture.resources().find(entry.resourceId()).orElseThrow().uri()).isEqualTo("repo://d1/a.md");
        assertThat(entry.transformations()).contains("repo://d1/a.md");
    }

    @Test
    void recordEntry_규칙과_어댑터가_모두_nature를_주면_규칙의_nature가_적용됨() {
        // given
        rules.register(PathMatchRule.of("typed", "\\.md$", "rule-nature", 1));
        adapter.put("/t/doc.md", "# Doc", "adapter-nature");
        IngestSessionId session = manager.open(d1, null, new BehaviorConfig().withRuleNamespace("typed"));
        IngestPathId pathId = manager.registerPath(session, "/t", null, null);

        // when
        PathEntry entry = manager.recordEntry(pathId, "/t/doc.md", "doc.md");

        // then
        assertThat(fixture.resources().find(entry.resourceId()).orElseThrow().nature()).isEqualTo("rule-nature");
    }

    @Test
    void recordEntry_match_all_기본_규칙이면_어댑터의_nature가_적용됨() {
        // given
        adapter.put("/t/doc.md", "# Doc", "adapter-nature");
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/t", null, null);

        // when
        PathEntry entry = manager.recordEntry(pathId, "/t/doc.md", "doc.md");

        // then
        assertThat(fixture.resources().find(entry.resourceId()).orElseThrow().nature()).isEqualTo("adapter-nature");
    }

    // ============================================================
    // 3. 실패 경로
    // ============================================================

    @Test
    void recordEntry_어댑터가_실패하면_ERRORED이고_observer에_issue_전달() {
        // given
        List<String> issues = new CopyOnWriteArrayList<>();
        List<String> transitions = new CopyOnWriteArrayList<>();
        IngestionObserver observer = new IngestionObserver() {
            @Override
            public void onTransition(IngestSessionId sessionId, String fromState, String toState, String reason) {
                transitions.add(fromState + "->" + toState);
            }

            @Override
            public void onIssue(IngestSessionId sessionId, String type, String message, String unitId) {
                issues.add(type + ":" + unitId);
            }
        };
        adapter.failOn("/d1/b.md", "permission denied");
        IngestSessionId session = manager.open(d1, null, new BehaviorConfig(), observer);
        IngestPathId pathId = manager.registerPath(session, "/d1", null, null);

        // when
        PathEntry ok = manager.recordEntry(pathId, "/d1/a.md", "a.md");
        PathEntry failed = manager.recordEntry(pathId, "/d1/b.md", "b.md");
        IngestionSummary summary = manager.close(session);

        // then
        assertThat(ok.status()).isEqualTo(PathEntryStatus.ADMITTED);
        assertThat(failed.status()).isEqualTo(PathEntryStatus.ERRORED);
        assertThat(failed.state()).isEqualTo(PathEntryState.ERRORED);
        assertThat(failed.diagnostics()).contains("permission denied");
        assertThat(summary).isEqualTo(new IngestionSummary(1, 0, 0, 1));
        assertThat(issues).hasSize(1);
        assertThat(issues.get(0)).endsWith(":/d1/b.md");
        assertThat(transitions).containsExactly("OPEN->CLOSED");
    }

    @Test
    void open_Device를_모르면_DeviceUnknownException() {
        assertThatThrownBy(() -> openSession(DeviceId.generate()))
            .isInstanceOf(DeviceUnknownException.class);
    }

    @Test
    void open_SourceKind에_어댑터가_없으면_ReferentialException() {
        BehaviorConfig mailbox = new BehaviorConfig().withSourceKind(SourceKind.MAILBOX);

        assertThatThrownBy(() -> manager.open(d1, null, mailbox))
            .isInstanceOf(ReferentialException.class);
    }

    @Test
    void open_agent가_JSON이_아니면_ValidationException() {
        assertThatThrownBy(() -> manager.open(d1, "agent=x", new BehaviorConfig()))
            .isInstanceOf(ValidationException.class);
    }

    // ============================================================
    // 4. 세션 생명주기
    // ============================================================

    @Test
    void close_세션이_닫히면_종료_시각과_요약이_기록되고_behavior가_저장됨() {
        // given
        BehaviorConfig behavior = new BehaviorConfig().withName("nightly");
        IngestSessionId session = manager.open(d1, null, behavior);
        clock.advance(Duration.ofSeconds(30));

        // when
        manager.close(session);

        // then
        IngestSession stored = fixture.ingestSessions().findSession(session).orElseThrow();
        assertThat(stored.state()).isEqualTo(IngestSessionState.CLOSED);
        assertThat(stored.ingestFinishedAt()).isEqualTo(START.plusSeconds(30));
        assertThat(stored.elaboration()).contains("\"admitted\"");
        assertThat(fixture.devices().findBehavior(d1, "nightly")).contains(behavior);
    }

    @Test
    void close_두번_닫으면_AlreadyClosedException() {
        IngestSessionId session = openSession(d1);
        manager.close(session);

        assertThatThrownBy(() -> manager.close(session)).isInstanceOf(AlreadyClosedException.class);
    }

    @Test
    void registerPath_닫힌_세션이면_AlreadyClosedException() {
        IngestSessionId session = openSession(d1);
        manager.close(session);

        assertThatThrownBy(() -> manager.registerPath(session, "/d1", null, null))
            .isInstanceOf(AlreadyClosedException.class);
    }

    // ============================================================
    // 5. 경로가 아닌 수집 단위
    // ============================================================

    @Test
    void recordTask_메일_메시지도_같은_저장소로_admission됨() {
        // given
        adapter.put("imap://inbox/42", "Subject: hello");
        IngestSessionId session = openSession(d1);

        // when
        IngestTask task = manager.recordTask(session, "imap://inbox/42", "{\"folder\":\"INBOX\"}");
        IngestTask again = manager.recordTask(session, "imap://inbox/42", "{\"folder\":\"INBOX\"}");

        // then
        assertThat(task.status()).isEqualTo(PathEntryStatus.ADMITTED);
        assertThat(again.status()).isEqualTo(PathEntryStatus.DUPLICATE);
        assertThat(again.resourceId()).isEqualTo(task.resourceId());
        assertThat(fixture.ingestSessions().tasksOf(session)).hasSize(2);
    }

    @Test
    void recordTask_capturedExecutable이_JSON이_아니면_ValidationException() {
        IngestSessionId session = openSession(d1);

        assertThatThrownBy(() -> manager.recordTask(session, "unit-1", "not json"))
            .isInstanceOf(ValidationException.class);
    }
}
