/**
 * JSON codec SPI. Implementations register a
 * {@link io.kyhttp.json.spi.JsonCodecProvider} in
 * {@code META-INF/services/io.kyhttp.json.spi.JsonCodecProvider}.
 */
package io.kyhttp.json.spi;
