package com.afterlands.aftercodec.core.sync;

import com.afterlands.aftercodec.api.error.SyncPolicyException;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.report.SyncReport;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Result of a sync: the updated target, the report and any policy violations.
 *
 * <p>Policy flags never change which entries were updated; they only decide
 * whether the overall outcome counts as a failure.</p>
 *
 * @param resource Updated target (same keys, same order)
 * @param report Counters and issues
 * @param policyViolations Violated policies, empty when the sync is acceptable
 */
public record SyncResult(
        @NotNull Resource resource,
        @NotNull SyncReport report,
        @NotNull List<String> policyViolations
) {

    public SyncResult {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(report, "report cannot be null");
        policyViolations = List.copyOf(policyViolations);
    }

    public boolean isSuccess() {
        return policyViolations.isEmpty();
    }

    /**
     * Returns this result, or throws if a policy was violated.
     *
     * @return This result
     * @throws SyncPolicyException if {@link #policyViolations()} is not empty
     */
    @NotNull
    public SyncResult orThrow() {
        if (!policyViolations.isEmpty()) {
            throw new SyncPolicyException(policyViolations);
        }
        return this;
    }
}
