/**
 * Request and response model for kyhttp.
 *
 * <p>This module has no dependencies. It contains only:
 * <ul>
 *   <li>The immutable {@link io.kyhttp.core.RequestSpec} and its builder</li>
 *   <li>The {@link io.kyhttp.core.Response} value and the hook callbacks</li>
 *   <li>Small utilities (query string encoding, header lookup)</li>
 * </ul>
 *
 * <p>Execution (retry, batching) and transports live in other modules.
 */
package io.kyhttp.core;
