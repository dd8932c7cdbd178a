package com.bank_ledger_sync.exception;

import lombok.Getter;

@Getter
public class AggregatorTransportException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public AggregatorTransportException(String message, int status, String responseBody) {
        super(message + " (status " + status + "): " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    public AggregatorTransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }
}
