package com.afterlands.aftercodec.core.batch;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Processes many inputs independently and reports failures at the end.
 *
 * <p>A failing input never stops the run: the remaining inputs are still processed
 * (and may still write their output). The caller turns the {@link BatchResult}
 * into an exit status.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * BatchResult result = new BatchRunner(logger).run(files, Path::toString, file -> {
 *     Resource resource = fileService.read(file, options).resource();
 *     fileService.write(outputFor(file), resource, writeOptions);
 * });
 * }</pre>
 */
public class BatchRunner {

    private final Logger logger;

    public BatchRunner(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    @NotNull
    public <T> BatchResult run(@NotNull List<T> inputs, @NotNull BatchTask<T> task) {
        return run(inputs, String::valueOf, task);
    }

    /**
     * Runs the task over every input.
     *
     * @param inputs Inputs, processed in order
     * @param label Human-readable name of an input
     * @param task Work to apply
     * @return Successes and failures
     */
    @NotNull
    public <T> BatchResult run(
            @NotNull List<T> inputs,
            @NotNull Function<T, String> label,
            @NotNull BatchTask<T> task
    ) {
        List<String> succeeded = new ArrayList<>();
        List<BatchResult.Failure> failures = new ArrayList<>();

        for (T input : inputs) {
            String name = label.apply(input);
            try {
                task.process(input);
                succeeded.add(name);
                logger.fine("[BatchRunner] Processed " + name);
            } catch (Exception e) {
                failures.add(new BatchResult.Failure(name, e));
                logger.warning("[BatchRunner] Failed " + name + ": " + e.getMessage());
            }
        }

        BatchResult result = new BatchResult(succeeded, failures);
        if (result.isSuccess()) {
            logger.info("[BatchRunner] Processed " + succeeded.size() + " inputs");
        } else {
            logger.warning("[BatchRunner] " + failures.size() + " of " + result.total() + " inputs failed");
        }
        return result;
    }
}
