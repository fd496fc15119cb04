package com.company.radar.service.email;

/**
 * Outbound transactional email. One call sends to exactly one recipient.
 */
public interface EmailProvider {

    /**
     * @return true when the provider accepted the message
     * @throws com.company.radar.exception.EmailSendException on transport failure
     */
    boolean send(EmailMessage message);

    String name();
}
