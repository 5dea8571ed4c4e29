package com.ryuqq.selection.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkExecutorConfigTest {

    @Test
    void 기본값() {
        BulkExecutorConfig config = new BulkExecutorConfig();

        assertThat(config.workerThreads()).isEqualTo(8);
        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.softTimeoutMs()).isEqualTo(600000);
        assertThat(config.maxReportedFailures()).isEqualTo(100);
        assertThat(config.dedupeEnabled()).isTrue();
    }

    @Test
    void withX는_해당_값만_바꾼다() {
        BulkExecutorConfig config = new BulkExecutorConfig().withConcurrency(1).withMaxRetries(0);

        assertThat(config.concurrency()).isEqualTo(1);
        assertThat(config.maxRetries()).isZero();
        assertThat(config.workerThreads()).isEqualTo(8);
    }

    @Test
    void 잘못된_값은_거부된다() {
        assertThatThrownBy(() -> new BulkExecutorConfig().withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency must be positive");
        assertThatThrownBy(() -> new BulkExecutorConfig().withSoftTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BulkExecutorConfig().withMaxReportedFailures(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
