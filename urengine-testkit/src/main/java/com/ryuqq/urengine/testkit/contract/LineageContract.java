package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.application.lineage.LineageIndexer;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.UnknownGraphException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract for {@link com.ryuqq.urengine.core.spi.LineageStore} implementations.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class LineageContract extends AbstractEngineContractTest {

    private DeviceId d1;
    private IngestSessionId session;
    private ResourceId r1;
    private ResourceId r2;

    @BeforeEach
    protected void setUpResources() {
        d1 = registerDevice("D1");
        session = openSession(d1);
        r1 = fixture.resources().admit(textCandidate(d1, "/a.txt", "a"), session).id();
        r2 = fixture.resources().admit(textCandidate(d1, "/b.txt", "b"), session).id();
    }

    // ============================================================
    // 1. link / neighbors
    // ============================================================

    @Test
    void link_등록된_그래프에_연결하면_neighbors로_조회됨() {
        // given
        lineage.registerGraph("topics", null);

        // when
        lineage.link("topics", "mentions", "topic-1", r1);
        lineage.link("topics", "mentions", "topic-1", r2);
        lineage.link("topics", "cites", "topic-1", r2);

        // then
        assertThat(lineage.neighbors("topics", "topic-1", "mentions")).containsExactly(r1, r2);
        assertThat(lineage.neighbors("topics", "topic-1", null)).containsExactly(r1, r2);
        assertThat(lineage.neighbors("topics", "topic-1", "cites")).containsExactly(r2);
        assertThat(lineage.nodesOf("topics", r2)).containsExactly("topic-1");
    }

    @Test
    void link_같은_인자로_반복하면_no_op() {
        // given
        lineage.registerGraph("topics", null);

        // when
        boolean first = lineage.link("topics", "mentions", "topic-1", r1);
        boolean second = lineage.link("topics", "mentions", "topic-1", r1);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(fixture.lineage().edges("topics")).hasSize(1);
    }

    @Test
    void neighbors_반복할_때마다_현재_edge를_다시_읽음() {
        // given
        lineage.registerGraph("topics", null);
        lineage.link("topics", "mentions", "topic-1", r1);
        Iterable<ResourceId> neighbors = lineage.neighbors("topics", "topic-1", null);
        assertThat(neighbors).containsExactly(r1);

        // when
        lineage.link("topics", "mentions", "topic-1", r2);

        // then
        assertThat(neighbors).containsExactly(r1, r2);
        assertThat(neighbors).containsExactly(r1, r2);
    }

    @Test
    void registerGraph_두번째_등록은_false() {
        assertThat(lineage.registerGraph("g", "{\"owner\":\"x\"}")).isTrue();
        assertThat(lineage.registerGraph("g", null)).isFalse();
        assertThat(fixture.lineage().findGraph("g")).isPresent();
    }

    // ============================================================
    // 2. 오류
    // ============================================================

    @Test
    void link_등록되지_않은_그래프면_UnknownGraphException() {
        assertThatThrownBy(() -> lineage.link("missing", "mentions", "n", r1))
            .isInstanceOf(UnknownGraphException.class);
    }

    @Test
    void link_리소스가_없으면_ReferentialException() {
        lineage.registerGraph("topics", null);

        assertThatThrownBy(() -> lineage.link("topics", "mentions", "n", ResourceId.generate()))
            .isInstanceOf(ReferentialException.class);
    }

    @Test
    void neighbors_삭제된_리소스는_제외됨() {
        // given
        lineage.registerGraph("topics", null);
        lineage.link("topics", "mentions", "topic-1", r1);
        lineage.link("topics", "mentions", "topic-1", r2);

        // when
        fixture.resources().softDelete(r1, "tester");

        // then
        assertThat(lineage.neighbors("topics", "topic-1", null)).containsExactly(r2);
    }

    // ============================================================
    // 3. admission 연동
    // ============================================================

    @Test
    void indexer_신규_admission마다_Device_노드에_연결함() {
        // given
        fixture.resources().addAdmissionListener(new LineageIndexer(lineage, "by-device", "owns"));

        // when
        ResourceId r3 = fixture.resources().admit(textCandidate(d1, "/c.txt", "c"), session).id();
        fixture.resources().admit(textCandidate(d1, "/c.txt", "c"), session);

        // then
        List<String> nodes = lineage.nodesOf("by-device", r3);
        assertThat(nodes).containsExactly(d1.getValue());
        assertThat(lineage.neighbors("by-device", d1.getValue(), "owns")).containsExactly(r3);
    }
}
