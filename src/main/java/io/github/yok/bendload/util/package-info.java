/**
 * Shared utilities for bendload.
 *
 * <p>
 * Holds helpers that are not tied to one stage of the load, such as fatal error reporting.
 * </p>
 */
package io.github.yok.bendload.util;
