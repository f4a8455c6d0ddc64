package com.flagship.account_service.account.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends RuntimeException {

    private final long accountId;

    public AccountNotFoundException(long accountId) {
        super("Account with id [" + accountId + "] could not be found.");
        this.accountId = accountId;
    }
}
