package com.github.dimitryivaniuta.datacache.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    // longer / odd incoming ids are replaced, they end up in every log line
    public static final int CORRELATION_ID_MAX_LENGTH = 64;
}
