package com.company.radar.service.email;

import com.company.radar.config.RadarProperties;
import com.company.radar.exception.EmailSendException;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class SendGridEmailProviderTest {

    @Mock
    private RestTemplate restTemplate;

    private SendGridEmailProvider provider;

    private final EmailMessage message = EmailMessage.builder()
            .to("ops@example.com")
            .subject("subject")
            .body("body")
            .build();

    @BeforeEach
    void setUp() {
        RadarProperties properties = new RadarProperties();
        properties.getEmail().setSendgridApiKey("sg-key");
        provider = new SendGridEmailProvider(restTemplate, properties,
                OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    void shouldReportSuccessOnAccepted() {
        // given
        given(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .willReturn(new ResponseEntity<>(HttpStatus.ACCEPTED));

        // when
        boolean sent = provider.send(message);

        // then
        assertThat(sent).isTrue();
        ArgumentCaptor<HttpEntity> request = ArgumentCaptor.forClass(HttpEntity.class);
        then(restTemplate).should().postForEntity(eq("https://api.sendgrid.com/v3/mail/send"),
                request.capture(), eq(String.class));
        assertThat(request.getValue().getHeaders().getFirst("Authorization")).isEqualTo("Bearer sg-key");
    }

    @Test
    void shouldReportFailureWhenSendGridRejectsTheMail() {
        // given
        given(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .willThrow(HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request",
                        new HttpHeaders(), new byte[0], null));

        // when
        boolean sent = provider.send(message);

        // then
        assertThat(sent).isFalse();
    }

    @Test
    void shouldRaiseWhenSendGridIsUnreachable() {
        // given
        given(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .willThrow(new ResourceAccessException("connect timed out"));

        // when / then
        assertThatThrownBy(() -> provider.send(message))
                .isInstanceOf(EmailSendException.class);
    }
}
