package com.afterlands.aftercodec.core.merge;

import com.afterlands.aftercodec.api.error.InvalidResourceException;
import com.afterlands.aftercodec.api.error.MergeConflict;
import com.afterlands.aftercodec.api.error.MergeConflictException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryKey;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Combines several resources into one.
 *
 * <p>Entries are grouped by (key, language) across all inputs. A group with a
 * single member, or whose members all carry the same value, passes through.
 * Otherwise the {@link MergeStrategy} decides.</p>
 *
 * <p>Only the value takes part in conflict detection. Members with equal values
 * but a different status or comment are not a conflict, even under
 * {@link MergeStrategy#ERROR}: the last member supplies status and comment under
 * LAST, the first one otherwise.</p>
 *
 * <h3>Ordering:</h3>
 * <p>The output keeps the first-seen order of each (key, language) across the
 * concatenated inputs; the slot holds whichever entry the strategy kept.</p>
 *
 * <h3>Metadata:</h3>
 * <p>The first input's metadata, with later inputs only adding keys not yet present.</p>
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * Resource merged = engine.merge(List.of(base, overrides), MergeStrategy.LAST);
 * }</pre>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public class MergeEngine {

    private final Logger logger;
    private final boolean debug;

    public MergeEngine(@NotNull Logger logger, boolean debug) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    /**
     * Merges resources.
     *
     * @param inputs Resources in priority order (first = earliest)
     * @param strategy Conflict strategy
     * @return Merged resource
     * @throws InvalidResourceException if no input is given
     * @throws MergeConflictException with every conflict, when strategy is ERROR
     */
    @NotNull
    public Resource merge(@NotNull List<Resource> inputs, @NotNull MergeStrategy strategy) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");

        if (inputs.isEmpty()) {
            throw new InvalidResourceException("Nothing to merge: input list is empty");
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        Map<EntryKey, List<Entry>> groups = new LinkedHashMap<>();

        for (Resource input : inputs) {
            for (Map.Entry<String, String> meta : input.metadata().entrySet()) {
                metadata.putIfAbsent(meta.getKey(), meta.getValue());
            }
            for (Entry entry : input.entries()) {
                groups.computeIfAbsent(entry.id(), id -> new ArrayList<>()).add(entry);
            }
        }

        List<Entry> merged = new ArrayList<>(groups.size());
        List<MergeConflict> conflicts = new ArrayList<>();
        int resolved = 0;

        for (Map.Entry<EntryKey, List<Entry>> group : groups.entrySet()) {
            List<Entry> members = group.getValue();
            List<Translation> distinct = distinctValues(members);

            if (distinct.size() <= 1) {
                Entry kept = pick(members, strategy);
                if (members.stream().anyMatch(m -> m.status() != kept.status())) {
                    logger.fine("[MergeEngine] " + group.getKey() + " has equal values with differing status, kept "
                            + kept.status().getKey());
                }
                merged.add(kept);
                continue;
            }

            EntryKey id = group.getKey();
            switch (strategy) {
                case FIRST, LAST -> {
                    Entry kept = pick(members, strategy);
                    merged.add(kept);
                    resolved++;
                    if (debug) {
                        logger.fine("[MergeEngine] " + strategy + ": " + id + " -> \"" + kept.value() + "\"");
                    }
                }
                case ERROR -> conflicts.add(new MergeConflict(id.key(), id.language(), distinct));
            }
        }

        if (!conflicts.isEmpty()) {
            logger.warning("[MergeEngine] " + conflicts.size() + " conflict(s) across " + inputs.size() + " inputs");
            throw new MergeConflictException(conflicts);
        }

        logger.fine("[MergeEngine] Merged " + inputs.size() + " resources into " + merged.size()
                + " entries (" + resolved + " conflicts resolved by " + strategy + ")");

        return new Resource(metadata, merged);
    }

    @NotNull
    private static Entry pick(@NotNull List<Entry> members, @NotNull MergeStrategy strategy) {
        return strategy == MergeStrategy.LAST ? members.get(members.size() - 1) : members.get(0);
    }

    @NotNull
    private static List<Translation> distinctValues(@NotNull List<Entry> members) {
        List<Translation> distinct = new ArrayList<>();
        for (Entry member : members) {
            if (!distinct.contains(member.value())) {
                distinct.add(member.value());
            }
        }
        return distinct;
    }
}
