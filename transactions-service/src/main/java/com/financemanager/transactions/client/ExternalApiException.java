package com.financemanager.transactions.client;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

/**
 * The catalog API could not be reached, answered with a non-2xx status or sent a body
 * that could not be read.
 */
public class ExternalApiException extends BusinessException {

    public static final String CODE = "EXTERNAL_API_ERROR";

    public ExternalApiException(String message, Throwable cause) {
        super(ErrorsFactory.badGateway(CODE, message), cause);
    }
}
