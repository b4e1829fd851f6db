package io.kyhttp.client;

import io.kyhttp.core.Response;

import java.util.Objects;

/**
 * A batch response with its body decoded as JSON.
 *
 * @param response the raw response
 * @param json the decoded body (maps, lists, scalars), or null if the body is not JSON
 */
public record JsonResponse(Response response, Object json) {
    public JsonResponse {
        Objects.requireNonNull(response, "response");
    }

    public int status() {
        return response.status();
    }
}
