package com.ryuqq.urengine.application.ingest;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.spi.SourceAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceAdapterRegistryTest {

    @Mock
    private SourceAdapter first;

    @Mock
    private SourceAdapter second;

    @Test
    void register_같은_kind면_나중_어댑터로_교체() {
        // given
        when(first.kind()).thenReturn(SourceKind.FILESYSTEM);
        when(second.kind()).thenReturn(SourceKind.FILESYSTEM);

        // when
        SourceAdapterRegistry registry = new SourceAdapterRegistry().register(first).register(second);

        // then
        assertThat(registry.require(SourceKind.FILESYSTEM)).isSameAs(second);
    }

    @Test
    void require_등록되지_않은_kind면_ReferentialException() {
        // given
        SourceAdapterRegistry registry = new SourceAdapterRegistry();

        // when & then
        assertThat(registry.find(SourceKind.MAILBOX)).isEmpty();
        assertThatThrownBy(() -> registry.require(SourceKind.MAILBOX))
            .isInstanceOf(ReferentialException.class)
            .hasMessageContaining("MAILBOX");
    }

    @Test
    void register_kind가_null이면_IllegalArgumentException() {
        // given
        when(first.kind()).thenReturn(null);

        // when & then
        assertThatThrownBy(() -> new SourceAdapterRegistry().register(first))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
