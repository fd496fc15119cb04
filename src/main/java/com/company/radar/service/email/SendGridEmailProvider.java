package com.company.radar.service.email;

import com.company.radar.config.RadarProperties;
import com.company.radar.exception.EmailSendException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * SendGrid v3 mail/send. The API answers 202 Accepted on success.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "radar.email.provider", havingValue = "sendgrid", matchIfMissing = true)
public class SendGridEmailProvider implements EmailProvider {

    private final RestTemplate restTemplate;
    private final RadarProperties properties;
    private final Tracer tracer;

    @Override
    public boolean send(EmailMessage message) {
        RadarProperties.Email email = properties.getEmail();

        Span span = tracer.spanBuilder("radar.email.send")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("email.provider", name());

            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(email.getSendgridApiKey());
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> payload = Map.of(
                    "personalizations", List.of(Map.of("to", List.of(Map.of("email", message.getTo())))),
                    "from", Map.of("email", email.getFromAddress()),
                    "subject", message.getSubject(),
                    "content", List.of(Map.of("type", "text/plain", "value", message.getBody())));

            ResponseEntity<String> response = restTemplate.postForEntity(
                    email.getSendgridBaseUrl() + "/v3/mail/send",
                    new HttpEntity<>(payload, headers),
                    String.class);

            int status = response.getStatusCode().value();
            span.setAttribute("http.status_code", status);

            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("SendGrid returned {} for {}", status, message.getTo());
                span.setStatus(StatusCode.ERROR, "Non-2xx response");
                return false;
            }
            return true;

        } catch (RestClientResponseException e) {
            log.warn("SendGrid rejected mail to {}: {} {}", message.getTo(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Rejected by SendGrid");
            return false;

        } catch (RestClientException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to reach SendGrid");
            throw new EmailSendException("Failed to send mail through SendGrid", e);

        } finally {
            span.end();
        }
    }

    @Override
    public String name() {
        return "sendgrid";
    }
}
