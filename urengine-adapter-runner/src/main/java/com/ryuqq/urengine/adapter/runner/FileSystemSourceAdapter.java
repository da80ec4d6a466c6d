package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.spi.SourceAdapter;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로컬 파일시스템 Source Adapter.
 *
 * <p>경로의 파일을 읽어 후보를 만듭니다. nature는 비워 두어 경로 규칙이 정하도록 합니다.
 * 파일 크기와 수정 시각은 metadata JSON으로 전달됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class FileSystemSourceAdapter implements SourceAdapter {

    /**
     * 기본 최대 파일 크기 (64MB).
     */
    public static final long DEFAULT_MAX_SIZE_BYTES = 64L * 1024 * 1024;

    private final long maxSizeBytes;

    public FileSystemSourceAdapter() {
        this(DEFAULT_MAX_SIZE_BYTES);
    }

    /**
     * @param maxSizeBytes 이보다 큰 파일은 어댑터 실패로 처리
     */
    public FileSystemSourceAdapter(long maxSizeBytes) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException(
                "maxSizeBytes must be positive (current: " + maxSizeBytes + ")"
            );
        }
        this.maxSizeBytes = maxSizeBytes;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.FILESYSTEM;
    }

    @Override
    public SourceCandidate produceCandidate(IngestSessionId sessionId, String pathOrEquivalentId)
            throws AdapterException {
        Path path;
        try {
            path = Paths.get(pathOrEquivalentId);
        } catch (InvalidPathException e) {
            throw new AdapterException(pathOrEquivalentId, "Invalid path: " + e.getMessage(), e);
        }
        if (!Files.isRegularFile(path)) {
            throw new AdapterException(pathOrEquivalentId, "Not a regular file: " + pathOrEquivalentId);
        }

        try {
            long size = Files.size(path);
            if (size > maxSizeBytes) {
                throw new AdapterException(pathOrEquivalentId,
                    "File too large: " + size + " bytes (max: " + maxSizeBytes + ")");
            }
            byte[] content = Files.readAllBytes(path);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "filesystem");
            metadata.put("lastModified", Files.getLastModifiedTime(path).toInstant().toString());
            metadata.put("executable", Files.isExecutable(path));
            return new SourceCandidate(path.toAbsolutePath().normalize().toString(), content, content.length,
                null, StructuredPayloadValidator.toJson(metadata));
        } catch (IOException e) {
            throw new AdapterException(pathOrEquivalentId, "Failed to read " + pathOrEquivalentId, e);
        }
    }
}
