package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.TransformId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.resource.TransformCandidate;
import com.ryuqq.urengine.core.resource.UniformResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract for {@link com.ryuqq.urengine.core.spi.ResourceStore} implementations.
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>Admitting the same candidate twice yields one row</li>
 *   <li>Dedup is scoped by device, URI and size</li>
 *   <li>Transforms dedup on their own key</li>
 *   <li>Malformed payloads and unknown references write nothing</li>
 *   <li>Concurrent admission of one key inserts exactly once</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class ResourceStoreContract extends AbstractEngineContractTest {

    protected DeviceId d1;
    protected IngestSessionId session;

    @BeforeEach
    protected void setUpDevice() {
        d1 = registerDevice("D1");
        session = openSession(d1);
    }

    // ============================================================
    // 1. 멱등 admission
    // ============================================================

    @Test
    void admit_같은_후보를_두번_넣으면_같은_ID와_신규여부_false() {
        // given
        ResourceCandidate candidate = textCandidate(d1, "/data/a.txt", "hello");

        // when
        Admission<ResourceId> first = fixture.resources().admit(candidate, session);
        Admission<ResourceId> second = fixture.resources().admit(candidate, session);

        // then
        assertThat(first.isNewRecord()).isTrue();
        assertThat(second.isNewRecord()).isFalse();
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(1);
    }

    @Test
    void admit_저장된_리소스는_digest와_provenance를_보존함() {
        // given
        ResourceCandidate candidate = textCandidate(d1, "/data/a.txt", "hello")
            .withFrontmatter("{\"title\":\"A\"}");

        // when
        ResourceId id = fixture.resources().admit(candidate, session).id();

        // then
        UniformResource stored = fixture.resources().find(id).orElseThrow();
        assertThat(stored.contentDigest()).isEqualTo(ContentDigest.sha256(utf8("hello")));
        assertThat(stored.ingestSessionId()).isEqualTo(session);
        assertThat(stored.sizeBytes()).isEqualTo(5);
        assertThat(stored.frontmatter()).isEqualTo("{\"title\":\"A\"}");
        assertThat(stored.content()).isEqualTo(utf8("hello"));
        assertThat(stored.housekeeping().createdAt()).isEqualTo(START);
    }

    // ============================================================
    // 2. 중복 제거 범위
    // ============================================================

    @Test
    void admit_같은_콘텐츠라도_Device가_다르면_별도_리소스() {
        // given
        DeviceId d2 = registerDevice("D2");
        IngestSessionId session2 = openSession(d2);

        // when
        ResourceId r1 = fixture.resources().admit(textCandidate(d1, "/x.txt", "same"), session).id();
        ResourceId r2 = fixture.resources().admit(textCandidate(d2, "/x.txt", "same"), session2).id();

        // then
        assertThat(r1).isNotEqualTo(r2);
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(1);
        assertThat(fixture.resources().countForDevice(d2)).isEqualTo(1);
    }

    @Test
    void admit_같은_콘텐츠라도_URI가_다르면_별도_리소스() {
        // when
        Admission<ResourceId> a = fixture.resources().admit(textCandidate(d1, "/one.txt", "same"), session);
        Admission<ResourceId> b = fixture.resources().admit(textCandidate(d1, "/two.txt", "same"), session);

        // then
        assertThat(a.isNewRecord()).isTrue();
        assertThat(b.isNewRecord()).isTrue();
        assertThat(a.id()).isNotEqualTo(b.id());
        assertThat(fixture.resources().findByDigest(d1, ContentDigest.sha256(utf8("same")))).isPresent();
    }

    @Test
    void admit_digest만_있는_참조_후보도_콘텐츠_후보와_같은_키() {
        // given
        ContentDigest digest = ContentDigest.sha256(utf8("body"));
        ResourceCandidate withContent = textCandidate(d1, "/ref.txt", "body");
        ResourceCandidate reference = ResourceCandidate.reference(d1, "/ref.txt", digest, 4, "txt");

        // when
        ResourceId first = fixture.resources().admit(withContent, session).id();
        Admission<ResourceId> second = fixture.resources().admit(reference, session);

        // then
        assertThat(second.isNewRecord()).isFalse();
        assertThat(second.id()).isEqualTo(first);
    }

    // ============================================================
    // 3. Transform
    // ============================================================

    @Test
    void admitTransform_nature가_다르면_별도_행이고_같으면_멱등() {
        // given
        ResourceId resource = fixture.resources().admit(textCandidate(d1, "/doc.md", "# Title"), session).id();

        // when
        Admission<TransformId> html = fixture.resources()
            .admitTransform(TransformCandidate.of(resource, "/doc.html", "html", "<h1>Title</h1>"));
        Admission<TransformId> htmlAgain = fixture.resources()
            .admitTransform(TransformCandidate.of(resource, "/doc.html", "html", "<h1>Title</h1>"));
        Admission<TransformId> text = fixture.resources()
            .admitTransform(TransformCandidate.of(resource, "/doc.txt", "text", "<h1>Title</h1>"));

        // then
        assertThat(html.isNewRecord()).isTrue();
        assertThat(htmlAgain.isNewRecord()).isFalse();
        assertThat(htmlAgain.id()).isEqualTo(html.id());
        assertThat(text.isNewRecord()).isTrue();
        assertThat(fixture.resources().transformsOf(resource)).hasSize(2);
    }

    @Test
    void admitTransform_원본이_없으면_ReferentialException() {
        assertThatThrownBy(() -> fixture.resources()
            .admitTransform(TransformCandidate.of(ResourceId.generate(), "/x", "html", "x")))
            .isInstanceOf(ReferentialException.class);
    }

    // ============================================================
    // 4. 검증과 참조 무결성
    // ============================================================

    @Test
    void admit_frontmatter가_JSON이_아니면_ValidationException이고_아무것도_쓰지_않음() {
        // given
        ResourceCandidate candidate = textCandidate(d1, "/bad.md", "body").withFrontmatter("{not json");

        // when / then
        assertThatThrownBy(() -> fixture.resources().admit(candidate, session))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getField())
            .isEqualTo("frontmatter");
        assertThat(fixture.resources().countForDevice(d1)).isZero();
    }

    @Test
    void admit_digest가_콘텐츠와_다르면_ValidationException() {
        // given
        ResourceCandidate candidate = new ResourceCandidate(d1, null, "/x.txt", utf8("abc"),
            ContentDigest.sha256(utf8("other")), 3, "txt", null, null, null, null);

        // when / then
        assertThatThrownBy(() -> fixture.resources().admit(candidate, session))
            .isInstanceOf(ValidationException.class);
        assertThat(fixture.resources().countForDevice(d1)).isZero();
    }

    @Test
    void admit_Device를_모르면_ReferentialException() {
        ResourceCandidate candidate = textCandidate(DeviceId.generate(), "/x.txt", "abc");

        assertThatThrownBy(() -> fixture.resources().admit(candidate, session))
            .isInstanceOf(ReferentialException.class);
    }

    @Test
    void admit_수집_세션을_모르면_ReferentialException() {
        ResourceCandidate candidate = textCandidate(d1, "/x.txt", "abc");

        assertThatThrownBy(() -> fixture.resources().admit(candidate, IngestSessionId.generate()))
            .isInstanceOf(ReferentialException.class);
        assertThat(fixture.resources().countForDevice(d1)).isZero();
    }

    // ============================================================
    // 5. 동시성과 listener
    // ============================================================

    @Test
    void admit_동시에_같은_키를_넣으면_정확히_한번만_삽입() throws Exception {
        // given
        int threads = 16;
        ResourceCandidate candidate = textCandidate(d1, "/race.txt", "contended");
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inserted = new AtomicInteger();
        Set<ResourceId> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        // when
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    Admission<ResourceId> admission = fixture.resources().admit(candidate, session);
                    ids.add(admission.id());
                    if (admission.isNewRecord()) {
                        inserted.incrementAndGet();
                    }
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
        assertThat(inserted.get()).isEqualTo(1);
        assertThat(ids).hasSize(1);
        assertThat(fixture.resources().countForDevice(d1)).isEqualTo(1);
    }

    @Test
    void admit_listener는_신규_행에만_한번_호출됨() {
        // given
        List<UniformResource> notified = new ArrayList<>();
        fixture.resources().addAdmissionListener(notified::add);
        ResourceCandidate candidate = textCandidate(d1, "/l.txt", "listen");

        // when
        fixture.resources().admit(candidate, session);
        fixture.resources().admit(candidate, session);

        // then
        assertThat(notified).hasSize(1);
        assertThat(notified.get(0).uri()).isEqualTo("/l.txt");
    }

    @Test
    void admit_listener가_실패해도_admission은_유지됨() {
        // given
        fixture.resources().addAdmissionListener(resource -> {
            throw new IllegalStateException("listener boom");
        });

        // when
        Admission<ResourceId> admission = fixture.resources().admit(textCandidate(d1, "/f.txt", "x"), session);

        // then
        assertThat(admission.isNewRecord()).isTrue();
        assertThat(fixture.resources().find(admission.id())).isPresent();
    }
}
