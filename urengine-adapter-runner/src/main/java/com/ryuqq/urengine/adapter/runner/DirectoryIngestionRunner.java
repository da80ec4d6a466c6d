package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.application.ingest.IngestionSessionManager;
import com.ryuqq.urengine.core.exception.ConcurrencyConflictException;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.IngestionSummary;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 디렉토리 트리 수집 Runner.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(deviceId, root, ...)
 *   1. manager.open() → 세션 생성
 *   2. manager.registerPath(root)
 *   3. 트리 탐색 → 일반 파일 목록 (정렬)
 *   4. 파일마다 recordEntry()를 worker pool에 제출
 *   5. 모든 작업 대기 (awaitTimeoutMs)
 *   6. manager.close() → 요약 반환
 * </pre>
 *
 * <p>저장소 접근 불가는 치명적 오류로, 남은 작업을 취소하고 세션을 열린 상태로 둔 채 던집니다.
 * 그 외 엔트리 단위 예외는 기록 후 다음 엔트리로 진행합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class DirectoryIngestionRunner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryIngestionRunner.class);

    private final IngestionSessionManager manager;
    private final IngestionRunnerConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 생성자.
     *
     * @param manager 수집 세션 관리자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DirectoryIngestionRunner(IngestionSessionManager manager, IngestionRunnerConfig config) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.manager = manager;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 디렉토리 트리 수집 (관찰자 없음).
     *
     * @see #run(DeviceId, Path, String, BehaviorConfig, List, List, IngestionObserver)
     */
    public IngestionRun run(DeviceId deviceId, Path root, String agent, BehaviorConfig behavior) {
        return run(deviceId, root, agent, behavior, null, null, IngestionObserver.NOOP);
    }

    /**
     * 디렉토리 트리 수집.
     *
     * @param deviceId 수집 대상 Device
     * @param root 루트 디렉토리
     * @param agent 에이전트 정보 (JSON, null 가능)
     * @param behavior 수집 동작 설정
     * @param includeGlobs 포함 glob (null 가능)
     * @param excludeGlobs 제외 glob (null 가능)
     * @param observer 세션 관찰자
     * @return 세션 ID와 요약
     * @throws StoreUnavailableException 저장소 접근 불가 시
     * @throws ConcurrencyConflictException 저장소가 원자적 admission을 보장하지 못한 경우
     * @throws IllegalStateException awaitTimeoutMs 안에 끝나지 않은 경우
     */
    public IngestionRun run(DeviceId deviceId, Path root, String agent, BehaviorConfig behavior,
                            List<String> includeGlobs, List<String> excludeGlobs, IngestionObserver observer) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("root must be a directory: " + root);
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();

        // 1. 세션 생성
        IngestSessionId sessionId = manager.open(deviceId, agent, behavior, observer);
        log.info("Directory ingestion started: session={}, root={}", sessionId, normalizedRoot);

        // 2. 루트 등록
        IngestPathId pathId = manager.registerPath(sessionId, normalizedRoot.toString(), includeGlobs, excludeGlobs);

        // 3. 탐색
        List<Path> files = listFiles(normalizedRoot);

        // 4. 제출
        List<Future<?>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            String abs = file.toString();
            String rel = normalizedRoot.relativize(file).toString().replace('\\', '/');
            futures.add(workerExecutor.submit(() -> manager.recordEntry(pathId, abs, rel)));
        }

        // 5. 대기
        awaitAll(sessionId, futures);

        // 6. 종료
        IngestionSummary summary = manager.close(sessionId);
        log.info("Directory ingestion completed: session={}, files={}, summary={}", sessionId, files.size(), summary);
        return new IngestionRun(sessionId, pathId, summary);
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private static List<Path> listFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
    }

    private void awaitAll(IngestSessionId sessionId, List<Future<?>> futures) {
        long deadlineNanos = System.nanoTime() + config.awaitTimeoutMs() * 1_000_000L;
        for (Future<?> future : futures) {
            try {
                long remaining = Math.max(0, deadlineNanos - System.nanoTime());
                future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StoreUnavailableException || cause instanceof ConcurrencyConflictException) {
                    log.error("Store failure, aborting ingestion session {}", sessionId, cause);
                    cancelAll(futures);
                    throw (RuntimeException) cause;
                }
                log.error("Entry failed in ingestion session {}", sessionId, cause);
            } catch (TimeoutException e) {
                cancelAll(futures);
                throw new IllegalStateException("Ingestion session " + sessionId + " timed out after "
                    + config.awaitTimeoutMs() + "ms", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new IllegalStateException("Ingestion interrupted: " + sessionId, e);
            }
        }
    }

    private static void cancelAll(List<Future<?>> futures) {
        futures.forEach(future -> future.cancel(true));
    }
}
