package com.acme.mxlegal;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

public final class RequestContext {
    public final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RequestContext(String requestId) {
        this.requestId = requestId;
    }

    public static RequestContext create() { return new RequestContext(UUID.randomUUID().toString()); }

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }
}
