package com.phillippitts.makeready.config.properties;

import com.phillippitts.makeready.domain.ConflictStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Report pipeline settings bound from {@code makeready.report.*}.
 */
@Validated
@ConfigurationProperties(prefix = "makeready.report")
public class ReportProperties {

    /** What happens to a batch when one pole cannot be built. */
    public enum FailurePolicy { SKIP_AND_COLLECT, ABORT_BATCH }

    /** Default conflict strategy for pole attributes. */
    @NotNull
    private final ConflictStrategy attributeStrategy;

    /** Attachment-height strategy. Advisory: recorded with the batch, heights follow the merge rules. */
    @NotNull
    private final ConflictStrategy heightStrategy;

    @NotNull
    private final FailurePolicy failurePolicy;

    /** Tolerance when checking whether the governing neutral is already listed (inches). */
    @Min(0)
    @Max(24)
    private final double neutralMatchToleranceInches;

    /** Smallest measured-to-recommended difference that counts as a move (inches). */
    @Min(0)
    @Max(12)
    private final double heightChangeToleranceInches;

    /** Passing capacity (percent) below which a pole is flagged. */
    @Min(0)
    @Max(100)
    private final double passingCapacityThreshold;

    @ConstructorBinding
    public ReportProperties(ConflictStrategy attributeStrategy, ConflictStrategy heightStrategy,
                            FailurePolicy failurePolicy, Double neutralMatchToleranceInches,
                            Double heightChangeToleranceInches, Double passingCapacityThreshold) {
        this.attributeStrategy = attributeStrategy == null ? ConflictStrategy.PREFER_ENGINEERING : attributeStrategy;
        this.heightStrategy = heightStrategy == null ? ConflictStrategy.PREFER_ENGINEERING : heightStrategy;
        this.failurePolicy = failurePolicy == null ? FailurePolicy.SKIP_AND_COLLECT : failurePolicy;

        double nt = neutralMatchToleranceInches == null ? 5.0 : neutralMatchToleranceInches;
        if (nt < 0.0 || nt > 24.0) {
            throw new IllegalArgumentException("makeready.report.neutral-match-tolerance-inches must be in [0,24]");
        }
        this.neutralMatchToleranceInches = nt;

        double ht = heightChangeToleranceInches == null ? 0.1 : heightChangeToleranceInches;
        if (ht < 0.0 || ht > 12.0) {
            throw new IllegalArgumentException("makeready.report.height-change-tolerance-inches must be in [0,12]");
        }
        this.heightChangeToleranceInches = ht;

        double pc = passingCapacityThreshold == null ? 85.0 : passingCapacityThreshold;
        if (pc < 0.0 || pc > 100.0) {
            throw new IllegalArgumentException("makeready.report.passing-capacity-threshold must be in [0,100]");
        }
        this.passingCapacityThreshold = pc;
    }

    // Backward-compatible constructor for tests and manual instantiation
    public ReportProperties(ConflictStrategy attributeStrategy, FailurePolicy failurePolicy) {
        this(attributeStrategy, null, failurePolicy, null, null, null);
    }

    public ConflictStrategy getAttributeStrategy() {
        return attributeStrategy;
    }

    public ConflictStrategy getHeightStrategy() {
        return heightStrategy;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public double getNeutralMatchToleranceInches() {
        return neutralMatchToleranceInches;
    }

    public double getHeightChangeToleranceInches() {
        return heightChangeToleranceInches;
    }

    public double getPassingCapacityThreshold() {
        return passingCapacityThreshold;
    }
}
