package com.company.radar.service.email;

import com.company.radar.config.RadarProperties;
import com.company.radar.exception.EmailSendException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "radar.email.provider", havingValue = "smtp")
public class SmtpEmailProvider implements EmailProvider {

    private final JavaMailSender mailSender;
    private final RadarProperties properties;

    @Override
    public boolean send(EmailMessage message) {
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            helper.setTo(message.getTo());
            helper.setFrom(properties.getEmail().getFromAddress());
            helper.setSubject(message.getSubject());
            helper.setText(message.getBody(), false);
            mailSender.send(mime);
            return true;

        } catch (MessagingException | MailException e) {
            log.error("SMTP send to {} failed: {}", message.getTo(), e.getMessage());
            throw new EmailSendException("Failed to send mail over SMTP", e);
        }
    }

    @Override
    public String name() {
        return "smtp";
    }
}
