/**
 * Input sources of a load.
 *
 * <p>
 * Turns a file path, an {@code http(s)} URL or standard input into the same forward-only
 * {@link io.github.yok.bendload.source.LineStream}, so that the stages in {@code core} do not
 * depend on where the records come from.
 * </p>
 */
package io.github.yok.bendload.source;
