package io.github.yok.bendload.core;

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Renders the lines of a batch into the value list of an {@code INSERT} statement.
 *
 * <p>
 * Each line is stripped; a blank line is dropped, any other line {@code 1,a} becomes the fragment
 * {@code (1,a)}. Field values are passed through verbatim: no quoting, escaping or type coercion is
 * applied.
 * </p>
 *
 * <p>
 * Lines are rendered in parallel on a dedicated pool and the fragments are joined with
 * {@code ", "}. The stream is unordered, so the fragment order inside one value list may differ
 * from the line order of the batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RecordTransformer implements AutoCloseable {

    private final ForkJoinPool pool;

    /**
     * Creates a transformer with its own worker pool.
     *
     * @param parallelism number of workers (1 or more)
     */
    public RecordTransformer(int parallelism) {
        Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s",
                parallelism);
        this.pool = new ForkJoinPool(parallelism);
    }

    /**
     * Renders one line.
     *
     * @param line raw line
     * @return the fragment, or {@code null} if the line is blank
     */
    static String toFragment(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() ? null : "(" + stripped + ")";
    }

    /**
     * Renders a batch into a value list.
     *
     * @param batch batch to render
     * @return comma-joined fragments, or empty if every line of the batch was blank
     */
    public Optional<String> transform(Batch batch) {
        try {
            String values = pool.submit(() -> batch.getLines().parallelStream().unordered()
                    .map(RecordTransformer::toFragment).filter(Objects::nonNull)
                    .collect(Collectors.joining(", "))).get();
            return values.isEmpty() ? Optional.empty() : Optional.of(values);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rendering batch " + batch.getIndex(),
                    e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to render batch " + batch.getIndex(),
                    e.getCause());
        }
    }

    /**
     * Shuts down the worker pool.
     */
    @Override
    public void close() {
        pool.shutdown();
    }
}
