package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.spi.TokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TokenReaper 유닛 테스트.
 *
 * <ul>
 *   <li>배치가 가득 차는 동안 반복 호출</li>
 *   <li>스캔당 최대 배치 수 제한</li>
 *   <li>저장소 장애 시 부분 결과 반환</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TokenReaperTest {

    @Mock
    private TokenStore tokenStore;

    private TokenReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new TokenReaper(tokenStore, new TokenReaperConfig().withBatchSize(10).withMaxBatchesPerScan(5));
    }

    @Test
    void scan_배치가_가득_차면_다음_배치를_계속_정리함() {
        // given
        when(tokenStore.purgeExpired(10)).thenReturn(10, 10, 3);

        // when
        int purged = reaper.scan();

        // then
        assertThat(purged).isEqualTo(23);
        verify(tokenStore, times(3)).purgeExpired(10);
    }

    @Test
    void scan_maxBatchesPerScan에서_멈춤() {
        // given
        when(tokenStore.purgeExpired(10)).thenReturn(10);

        // when
        int purged = reaper.scan();

        // then
        assertThat(purged).isEqualTo(50);
        verify(tokenStore, times(5)).purgeExpired(10);
    }

    @Test
    void scan_정리할_토큰이_없으면_0() {
        when(tokenStore.purgeExpired(10)).thenReturn(0);

        assertThat(reaper.scan()).isZero();
        verify(tokenStore, times(1)).purgeExpired(10);
    }

    @Test
    void scan_저장소_장애_시_그때까지_정리한_수를_반환함() {
        // given
        when(tokenStore.purgeExpired(10))
            .thenReturn(10)
            .thenThrow(new StoreUnavailableException("down"));

        // when
        int purged = reaper.scan();

        // then
        assertThat(purged).isEqualTo(10);
    }

    @Test
    void 생성자_null_의존성은_거부됨() {
        assertThatThrownBy(() -> new TokenReaper(null, new TokenReaperConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("tokenStore cannot be null");
        assertThatThrownBy(() -> new TokenReaperConfig().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
