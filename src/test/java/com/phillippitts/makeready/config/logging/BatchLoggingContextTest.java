package com.phillippitts.makeready.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BatchLoggingContextTest {

    @BeforeEach
    void setUp() {
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldUseSuppliedBatchId() {
        try (BatchLoggingContext context = BatchLoggingContext.open("batch-7", "PREFER_SURVEY")) {
            assertThat(context.batchId()).isEqualTo("batch-7");
            assertThat(ThreadContext.get(BatchLoggingContext.BATCH_ID)).isEqualTo("batch-7");
            assertThat(ThreadContext.get(BatchLoggingContext.STRATEGY)).isEqualTo("PREFER_SURVEY");
        }
    }

    @Test
    void shouldGenerateBatchIdWhenBlank() {
        try (BatchLoggingContext context = BatchLoggingContext.open("  ", "PREFER_ENGINEERING")) {
            assertThat(context.batchId())
                    .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        }
    }

    @Test
    void shouldScopePoleToBlock() {
        try (BatchLoggingContext context = BatchLoggingContext.open(null, "PREFER_SURVEY")) {
            try (BatchLoggingContext.PoleScope ignored = context.pole("PL410620")) {
                assertThat(ThreadContext.get(BatchLoggingContext.POLE)).isEqualTo("PL410620");
            }
            assertThat(ThreadContext.get(BatchLoggingContext.POLE)).isNull();
            assertThat(ThreadContext.get(BatchLoggingContext.BATCH_ID)).isNotNull();
        }
    }

    @Test
    void shouldRemoveOnlyOwnKeysOnClose() {
        ThreadContext.put("requestId", "req-1");

        try (BatchLoggingContext ignored = BatchLoggingContext.open("batch-1", "PREFER_SURVEY")) {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-1");
        }

        assertThat(ThreadContext.get(BatchLoggingContext.BATCH_ID)).isNull();
        assertThat(ThreadContext.get(BatchLoggingContext.STRATEGY)).isNull();
        assertThat(ThreadContext.get("requestId")).isEqualTo("req-1");
    }
}
