package io.kyhttp.core;

/**
 * HTTP request methods supported by the fluent builder.
 */
public enum Method {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS
}
