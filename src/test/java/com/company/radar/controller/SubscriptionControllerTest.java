package com.company.radar.controller;

import com.company.radar.domain.AlertSubscription;
import com.company.radar.exception.GlobalExceptionHandler;
import com.company.radar.security.AccountContext;
import com.company.radar.service.alert.SubscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SubscriptionControllerTest {

    private static final UUID ACCOUNT_ID = UUID.randomUUID();
    private static final UUID PROPERTY_ID = UUID.randomUUID();

    @Mock
    private SubscriptionService subscriptionService;
    @Mock
    private AccountContext accountContext;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SubscriptionController(subscriptionService, accountContext))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldCreateSubscription() throws Exception {
        // given
        UUID subscriptionId = UUID.randomUUID();
        given(subscriptionService.subscribe(ACCOUNT_ID, "ops@example.com", PROPERTY_ID))
                .willReturn(subscription(subscriptionId));

        // when / then
        mockMvc.perform(post("/api/v1/accounts/{accountId}/subscriptions", ACCOUNT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("ops@example.com")))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location",
                        "/api/v1/accounts/" + ACCOUNT_ID + "/subscriptions/" + subscriptionId))
                .andExpect(jsonPath("$.recipient").value("ops@example.com"));
    }

    @Test
    void shouldRejectInvalidRecipient() throws Exception {
        // when / then
        mockMvc.perform(post("/api/v1/accounts/{accountId}/subscriptions", ACCOUNT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("not-an-email")))
                .andExpect(status().isBadRequest());
        then(subscriptionService).should(never()).subscribe(any(), any(), any());
    }

    @Test
    void shouldReturnConflictForDuplicateSubscription() throws Exception {
        // given
        given(subscriptionService.subscribe(ACCOUNT_ID, "ops@example.com", PROPERTY_ID))
                .willThrow(new DuplicateKeyException("alert_subscriptions_unique"));

        // when / then
        mockMvc.perform(post("/api/v1/accounts/{accountId}/subscriptions", ACCOUNT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("ops@example.com")))
                .andExpect(status().isConflict());
    }

    @Test
    void shouldListSubscriptions() throws Exception {
        // given
        given(subscriptionService.list(ACCOUNT_ID)).willReturn(List.of(subscription(UUID.randomUUID())));

        // when / then
        mockMvc.perform(get("/api/v1/accounts/{accountId}/subscriptions", ACCOUNT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].propertyId").value(PROPERTY_ID.toString()));
    }

    @Test
    void shouldReturnNotFoundWhenNothingToDelete() throws Exception {
        // given
        UUID subscriptionId = UUID.randomUUID();
        given(subscriptionService.unsubscribe(ACCOUNT_ID, subscriptionId)).willReturn(false);

        // when / then
        mockMvc.perform(delete("/api/v1/accounts/{accountId}/subscriptions/{subscriptionId}",
                        ACCOUNT_ID, subscriptionId))
                .andExpect(status().isNotFound());
    }

    private static String body(String recipient) {
        return "{\"recipient\":\"" + recipient + "\",\"propertyId\":\"" + PROPERTY_ID + "\"}";
    }

    private static AlertSubscription subscription(UUID id) {
        return AlertSubscription.builder()
                .id(id)
                .accountId(ACCOUNT_ID)
                .recipient("ops@example.com")
                .propertyId(PROPERTY_ID)
                .build();
    }
}
