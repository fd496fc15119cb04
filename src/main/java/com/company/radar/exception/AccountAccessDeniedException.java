package com.company.radar.exception;

import java.util.UUID;

public class AccountAccessDeniedException extends RuntimeException {
    public AccountAccessDeniedException(String subject, UUID accountId) {
        super("Caller " + subject + " does not have access to account " + accountId);
    }
}
