package com.acme.devtools.flowtap.interceptor;

import com.acme.devtools.flowtap.flow.ResponseSnapshot;

/**
 * Result of running one exchange through the {@link FlowInterceptor}.
 *
 * @param flowId   coordinator-side id, {@code null} when the coordinator was bypassed
 * @param response the response to hand back to the application
 * @param modified true when {@code response} differs from the captured one
 */
public record InterceptedExchange(String flowId, ResponseSnapshot response, boolean modified) {

    static InterceptedExchange bypassed(ResponseSnapshot original) {
        return new InterceptedExchange(null, original, false);
    }
}
