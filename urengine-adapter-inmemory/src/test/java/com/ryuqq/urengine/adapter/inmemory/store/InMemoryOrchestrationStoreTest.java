package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.OrchestrationSession;
import com.ryuqq.urengine.core.orchestration.SessionLogEntry;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryOrchestrationStore 단위 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryOrchestrationStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryOrchestrationStore store;
    private OrchestrationSessionId sessionId;

    @BeforeEach
    void setUp() {
        store = new InMemoryOrchestrationStore();
        sessionId = insertSession(T0);
    }

    private OrchestrationSessionId insertSession(Instant startedAt) {
        OrchestrationSessionId id = OrchestrationSessionId.generate();
        store.insertSession(new OrchestrationSession(id, DeviceId.generate(), "n", "1", startedAt, null, null,
            null, null, null, Housekeeping.created(startedAt, null)));
        return id;
    }

    private ExecNode newExec(ExecId parent) {
        return ExecNode.started(ExecId.generate(), sessionId, null, parent, "step", "c", null,
            Housekeeping.created(T0, null));
    }

    private SessionLogEntry newLog(int order) {
        return new SessionLogEntry(LogId.generate(), sessionId, null, null, "info", "x", order, null,
            Housekeeping.created(T0, null));
    }

    @Test
    void insertExec_순서가_이미_부여된_노드는_거부() {
        ExecNode preassigned = newExec(null).withSiblingOrder(3);

        assertThatThrownBy(() -> store.insertExec(preassigned))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void insertExec_세션이_없으면_ReferentialException() {
        ExecNode orphan = ExecNode.started(ExecId.generate(), OrchestrationSessionId.generate(), null, null,
            "step", "c", null, Housekeeping.created(T0, null));

        assertThatThrownBy(() -> store.insertExec(orphan)).isInstanceOf(ReferentialException.class);
    }

    @Test
    void updateExec_형제_순서는_바꿀_수_없음() {
        // given
        ExecNode stored = store.insertExec(newExec(null));

        // when & then
        assertThatThrownBy(() -> store.updateExec(stored.id(), node -> node.withSiblingOrder(9)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.findExec(stored.id()).orElseThrow().siblingOrder()).isZero();
    }

    @Test
    void appendLog_명시_순서_이후_자동_순서는_비어있는_다음_값() {
        // given
        store.appendLog(newLog(0));
        store.appendLog(newLog(2));

        // when
        SessionLogEntry auto = store.appendLog(newLog(ExecNode.UNASSIGNED_ORDER));

        // then
        assertThat(auto.siblingOrder()).isEqualTo(3);
        assertThat(store.logsOf(sessionId)).hasSize(3);
    }

    @Test
    void upsertTransition_같은_키를_다시_쓰면_sequence가_증가함() {
        // when
        SessionTransition first = store.upsertTransition(sessionId, "OPEN", "RUNNING", null, "a", T0);
        SessionTransition second = store.upsertTransition(sessionId, "OPEN", "RUNNING", "{\"n\":1}", "b", T0);

        // then
        assertThat(second.sequence()).isGreaterThan(first.sequence());
        assertThat(store.findTransition(new SessionTransition.Key(sessionId, "OPEN", "RUNNING")))
            .map(SessionTransition::reason)
            .contains("b");
        assertThat(store.transitionHistory(sessionId)).hasSize(2);
    }

    @Test
    void listOpenSessions_시작_시각_순서로_정렬됨() {
        // given
        OrchestrationSessionId earlier = insertSession(T0.minusSeconds(60));
        OrchestrationSessionId finished = insertSession(T0.minusSeconds(120));
        store.markSessionFinished(finished, T0, null, null);

        // when & then
        assertThat(store.listOpenSessions())
            .extracting(OrchestrationSession::id)
            .containsExactly(earlier, sessionId);
    }

    @Test
    void ensureNature_같은_nature는_한번만_생성됨() {
        assertThat(store.ensureNature("n", "n", T0)).isSameAs(store.ensureNature("n", "n", T0.plusSeconds(5)));
    }
}
