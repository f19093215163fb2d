package com.afterlands.aftercodec.api.error;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown by a merge using the ERROR strategy when inputs disagree.
 *
 * <p>Carries every conflict found, not just the first one.</p>
 */
public class MergeConflictException extends CodecException {

    private final List<MergeConflict> conflicts;

    public MergeConflictException(@NotNull List<MergeConflict> conflicts) {
        super(ErrorCode.MERGE_CONFLICT, conflicts.size() + " merge conflict(s): " + conflicts);
        this.conflicts = List.copyOf(conflicts);
    }

    @NotNull
    public List<MergeConflict> getConflicts() {
        return conflicts;
    }
}
