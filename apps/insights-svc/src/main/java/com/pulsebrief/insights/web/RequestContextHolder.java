package com.pulsebrief.insights.web;

import java.util.Optional;

public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTenantId() {
        return get().map(RequestContext::tenantId).orElse(null);
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String tenantId, String traceId) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String tenantId;
            private String traceId;

            public Builder tenantId(String tenantId) {
                this.tenantId = tenantId;
                return this;
            }

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(tenantId, traceId);
            }
        }
    }
}
