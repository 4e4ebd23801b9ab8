package com.phillippitts.makeready.config.logging;

import org.apache.logging.log4j.ThreadContext;

import java.util.UUID;

/**
 * Log4j2 ThreadContext entries for one report batch.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>batchId: caller supplied, or generated UUID</li>
 *   <li>strategy: attribute conflict strategy in effect</li>
 *   <li>pole: pole number, only while that pole is being built</li>
 * </ul>
 *
 * <p>Closing removes only the keys this context added; entries owned by an enclosing request
 * survive.</p>
 */
public final class BatchLoggingContext implements AutoCloseable {

    public static final String BATCH_ID = "batchId";
    public static final String STRATEGY = "strategy";
    public static final String POLE = "pole";

    private final String batchId;

    private BatchLoggingContext(String batchId, String strategy) {
        this.batchId = batchId;
        ThreadContext.put(BATCH_ID, batchId);
        ThreadContext.put(STRATEGY, strategy);
    }

    /**
     * @param batchId  correlation id, or null/blank to generate one
     * @param strategy strategy name for log lines
     */
    public static BatchLoggingContext open(String batchId, String strategy) {
        String id = (batchId == null || batchId.isBlank()) ? UUID.randomUUID().toString() : batchId;
        return new BatchLoggingContext(id, strategy);
    }

    public String batchId() {
        return batchId;
    }

    /** Tags log lines with {@code poleNumber} until the returned scope is closed. */
    public PoleScope pole(String poleNumber) {
        ThreadContext.put(POLE, poleNumber);
        return new PoleScope();
    }

    @Override
    public void close() {
        ThreadContext.remove(POLE);
        ThreadContext.remove(STRATEGY);
        ThreadContext.remove(BATCH_ID);
    }

    /** Scope of a single pole inside the batch. */
    public static final class PoleScope implements AutoCloseable {

        private PoleScope() {
        }

        @Override
        public void close() {
            ThreadContext.remove(POLE);
        }
    }
}
