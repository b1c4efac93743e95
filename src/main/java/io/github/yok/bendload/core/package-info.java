/**
 * Core load workflow package.
 *
 * <p>
 * Resolves the target table, skips header lines, groups the source into batches, renders each
 * batch into an {@code INSERT} statement and dispatches it to the query service. Entry point is
 * {@link io.github.yok.bendload.core.BulkLoader}.
 * </p>
 *
 * <p>
 * Where records come from is handled in {@code source}; how statements reach the service is
 * handled in {@code client}.
 * </p>
 */
package io.github.yok.bendload.core;
