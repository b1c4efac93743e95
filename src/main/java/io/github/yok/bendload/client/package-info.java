/**
 * Transport to the remote query service.
 *
 * <p>
 * {@link io.github.yok.bendload.client.QueryEndpointClient} is the only seam between the load
 * stages and the network; the HTTP implementation posts statements as JSON and collects the
 * returned pages.
 * </p>
 */
package io.github.yok.bendload.client;
