package io.kyhttp.client;

import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;

/**
 * Runs the optional hooks of a request. Absent hooks are skipped; exceptions
 * thrown by a hook propagate to the caller.
 */
final class HookInvoker {
    private HookInvoker() {}

    static void invokeBefore(RequestSpec spec) {
        spec.beforeHook().ifPresent(hook -> hook.beforeRequest(spec));
    }

    static void invokeAfter(Response response) {
        response.request().afterHook().ifPresent(hook -> hook.afterResponse(response));
    }
}
