/**
 * Transport SPI.
 *
 * <p>{@link io.kyhttp.http.spi.HttpClientAdapter} is the only capability the
 * execution engine needs from the network. Adapters for the JDK HttpClient,
 * OkHttp and Apache HttpClient 5 are provided; the last two require their
 * library on the classpath.
 */
package io.kyhttp.http.spi;
