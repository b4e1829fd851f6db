package io.kyhttp.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Utility to build percent-encoded query strings and append them to URLs.
 */
public final class Urls {
    private Urls() {}

    /**
     * Encodes the parameters as {@code k=v} pairs joined by {@code &}, keeping
     * the iteration order of the map. Null keys are skipped; null values encode
     * as an empty string.
     */
    public static String queryString(Map<String, ?> params) {
        if (params == null || params.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ?> e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            Object v = e.getValue();
            sb.append(encode(e.getKey())).append('=').append(encode(v == null ? "" : String.valueOf(v)));
        }
        return sb.toString();
    }

    /**
     * Appends an already encoded query string to the URL.
     */
    public static String withQuery(String url, String queryString) {
        Objects.requireNonNull(url, "url");
        if (queryString == null || queryString.isEmpty()) return url;
        return url + (url.indexOf('?') >= 0 ? "&" : "?") + queryString;
    }

    /**
     * RFC 3986 percent-encoding: unreserved characters are kept, space becomes
     * {@code %20}.
     */
    public static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
