/**
 * Failure taxonomy shared by the collector and the exporter.
 *
 * <ul>
 *   <li>{@link io.meshgraph.error.TransientNetworkException}: broker unreachable or dropped; retried forever.</li>
 *   <li>{@link io.meshgraph.error.MalformedPayloadException}: undecodable envelope; counted and skipped.</li>
 *   <li>{@link io.meshgraph.error.StorageWriteException}: write retries exhausted; the event is dropped as a loss.</li>
 *   <li>{@link io.meshgraph.error.StorageUnavailableException}: store cannot be opened; fatal at startup.</li>
 * </ul>
 *
 * <p>Configuration problems are reported by {@link io.meshgraph.config.ConfigurationException}.
 */
package io.meshgraph.error;
