package com.financemanager.common.config;

/**
 * MDC keys shared by the request filter, the logging aspect and the error handler.
 */
public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String METHOD = "method";
    public static final String PATH = "path";
    public static final String EXECUTION_ID = "executionId";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private MdcKeys() {
    }
}
