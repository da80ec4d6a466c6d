package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.IngestSessionId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemSourceAdapterTest {

    @TempDir
    Path dir;

    private final IngestSessionId sessionId = IngestSessionId.generate();

    @Test
    void produceCandidate_파일_내용과_메타데이터를_읽음() throws Exception {
        // given
        Path file = Files.writeString(dir.resolve("a.md"), "# A");
        FileSystemSourceAdapter adapter = new FileSystemSourceAdapter();

        // when
        SourceCandidate candidate = adapter.produceCandidate(sessionId, file.toString());

        // then
        assertThat(adapter.kind()).isEqualTo(SourceKind.FILESYSTEM);
        assertThat(new String(candidate.content(), StandardCharsets.UTF_8)).isEqualTo("# A");
        assertThat(candidate.sizeBytes()).isEqualTo(3);
        assertThat(candidate.uri()).isEqualTo(file.toAbsolutePath().normalize().toString());
        assertThat(candidate.nature()).isNull();
        assertThat(candidate.metadataJson()).contains("\"source\":\"filesystem\"").contains("lastModified");
    }

    @Test
    void produceCandidate_없는_파일이면_AdapterException() {
        // given
        String missing = dir.resolve("missing.md").toString();

        // when & then
        assertThatThrownBy(() -> new FileSystemSourceAdapter().produceCandidate(sessionId, missing))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("Not a regular file")
            .satisfies(e -> assertThat(((AdapterException) e).getUnitId()).isEqualTo(missing));
    }

    @Test
    void produceCandidate_최대_크기를_넘으면_AdapterException() throws Exception {
        // given
        Path file = Files.writeString(dir.resolve("big.bin"), "0123456789");

        // when & then
        assertThatThrownBy(() -> new FileSystemSourceAdapter(4).produceCandidate(sessionId, file.toString()))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("File too large");
    }

    @Test
    void constructor_최대_크기가_0_이하면_IllegalArgumentException() {
        assertThatThrownBy(() -> new FileSystemSourceAdapter(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
