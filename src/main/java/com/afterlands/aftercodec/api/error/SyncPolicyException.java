package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown when a sync result violates the caller's fail-on-unmatched or
 * fail-on-ambiguous policy.
 */
public class SyncPolicyException extends CodecException {

    private final List<String> violations;

    public SyncPolicyException(@NotNull List<String> violations) {
        super(ErrorCode.SYNC_POLICY, "Sync policy violated: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    @NotNull
    public List<String> getViolations() {
        return violations;
    }
}
