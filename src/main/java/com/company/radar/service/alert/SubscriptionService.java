package com.company.radar.service.alert;

import com.company.radar.domain.AlertSubscription;
import com.company.radar.exception.AccountNotFoundException;
import com.company.radar.exception.PropertyNotFoundException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.repository.AlertSubscriptionRepository;
import com.company.radar.repository.PropertyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Recipient management. Changes affect only alerts whose deliveries have not
 * been materialized yet.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionService {

    private final AlertSubscriptionRepository subscriptionRepository;
    private final PropertyRepository propertyRepository;
    private final AccountRepository accountRepository;

    public List<AlertSubscription> list(UUID accountId) {
        requireAccount(accountId);
        return subscriptionRepository.findByAccount(accountId);
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when already subscribed
     */
    public AlertSubscription subscribe(UUID accountId, String recipient, UUID propertyId) {
        requireAccount(accountId);
        propertyRepository.findById(accountId, propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(accountId, propertyId));

        String normalized = recipient.trim().toLowerCase(Locale.ROOT);
        AlertSubscription subscription = subscriptionRepository.insert(accountId, normalized, propertyId);
        log.info("Subscribed {} to property {} of account {}", normalized, propertyId, accountId);
        return subscription;
    }

    public boolean unsubscribe(UUID accountId, UUID subscriptionId) {
        requireAccount(accountId);
        boolean deleted = subscriptionRepository.delete(accountId, subscriptionId);
        if (deleted) {
            log.info("Removed subscription {} of account {}", subscriptionId, accountId);
        }
        return deleted;
    }

    private void requireAccount(UUID accountId) {
        if (!accountRepository.exists(accountId)) {
            throw new AccountNotFoundException(accountId);
        }
    }
}
