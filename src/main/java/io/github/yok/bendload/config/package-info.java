/**
 * Configuration model package for bendload.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources): the query endpoint to talk to and the defaults of a load.
 * </p>
 *
 * <p>
 * This package only holds configuration data; the load itself is implemented in {@code core}.
 * </p>
 */
package io.github.yok.bendload.config;
