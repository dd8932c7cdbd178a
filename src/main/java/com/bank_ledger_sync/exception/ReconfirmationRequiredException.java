package com.bank_ledger_sync.exception;

import lombok.Getter;

@Getter
public class ReconfirmationRequiredException extends RuntimeException {

    private final String accountId;
    private final String agreementId;
    private final String reconfirmationUrl;

    public ReconfirmationRequiredException(String accountId, String agreementId, String reconfirmationUrl) {
        super("Agreement " + agreementId + " for account " + accountId
                + " needs reconfirmation, navigate to: " + reconfirmationUrl);
        this.accountId = accountId;
        this.agreementId = agreementId;
        this.reconfirmationUrl = reconfirmationUrl;
    }
}
