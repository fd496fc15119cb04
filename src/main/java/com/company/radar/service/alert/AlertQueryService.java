package com.company.radar.service.alert;

import com.company.radar.domain.Alert;
import com.company.radar.exception.AccountNotFoundException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AlertQueryService {

    static final int MAX_LIMIT = 200;

    private final AlertRepository alertRepository;
    private final AccountRepository accountRepository;

    public List<Alert> recentAlerts(UUID accountId, int limit) {
        if (!accountRepository.exists(accountId)) {
            throw new AccountNotFoundException(accountId);
        }
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return alertRepository.findByAccount(accountId, bounded);
    }
}
