package com.afterlands.aftercodec.core.batch;

/**
 * Unit of work applied to one batch input.
 *
 * @param <T> Input type (usually a {@link java.nio.file.Path})
 */
@FunctionalInterface
public interface BatchTask<T> {

    void process(T input) throws Exception;
}
