/**
 * Fluent client and execution engine.
 *
 * <p>{@link io.kyhttp.client.SingleRequestExecutor} sends one request at a time
 * and throws when retries run out; {@link io.kyhttp.client.BatchExecutor} runs a
 * {@link io.kyhttp.client.BatchQueue} concurrently in rounds and returns every
 * final response. Both share the accept/retry rule of
 * {@link io.kyhttp.client.AttemptRecord}.
 */
package io.kyhttp.client;
