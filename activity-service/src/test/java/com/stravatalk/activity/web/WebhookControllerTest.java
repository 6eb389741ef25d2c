package com.stravatalk.activity.web;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.AuthorizationException;
import com.stravatalk.activity.error.DatabaseException;
import com.stravatalk.activity.error.ForeignSubscriptionException;
import com.stravatalk.activity.model.WebhookEvent;
import com.stravatalk.activity.service.WebhookEventRouter;
import com.stravatalk.activity.service.WebhookSubscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookController")
class WebhookControllerTest {

    @Mock
    private WebhookEventRouter router;
    @Mock
    private WebhookSubscriptionService subscriptionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ActivityServiceProperties properties = new ActivityServiceProperties();
        properties.getWebhook().setVerifyToken("secret");
        mockMvc = MockMvcBuilders
                .standaloneSetup(new WebhookController(router, subscriptionService, properties))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("GET /webhook")
    class Verification {

        @Test
        void echoesChallengeForMatchingToken() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.challenge", "15f7d1a91c1f40f8a748fd134752feb3")
                            .param("hub.verify_token", "secret"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$['hub.challenge']").value("15f7d1a91c1f40f8a748fd134752feb3"))
                    .andExpect(jsonPath("$.challenge").value("15f7d1a91c1f40f8a748fd134752feb3"));
        }

        @Test
        void acceptsPlainParameterNames() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("mode", "subscribe")
                            .param("challenge", "abc")
                            .param("verify_token", "secret"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.challenge").value("abc"));
        }

        @Test
        void refusesWrongTokenWithoutEcho() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.challenge", "abc")
                            .param("hub.verify_token", "guess"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.challenge").doesNotExist());
        }

        @Test
        void refusesWrongMode() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "unsubscribe")
                            .param("hub.challenge", "abc")
                            .param("hub.verify_token", "secret"))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("POST /webhook")
    class Delivery {

        private static final String DELETE_EVENT = """
                {"aspect_type": "delete", "event_time": 1516126040, "object_id": 1360128428,
                 "object_type": "activity", "owner_id": 134815, "subscription_id": 120475, "updates": {}}
                """;

        @Test
        void acknowledgesAppliedEvent() throws Exception {
            when(router.route(any(WebhookEvent.class))).thenReturn(WebhookEventRouter.Outcome.APPLIED);

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DELETE_EVENT))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("applied"));

            ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
            verify(router).route(captor.capture());
            assertThat(captor.getValue().getObjectId()).isEqualTo(1360128428L);
            assertThat(captor.getValue().getOwnerId()).isEqualTo(134815L);
            assertThat(captor.getValue().aspect()).isEqualTo(WebhookEvent.AspectType.DELETE);
        }

        @Test
        void acknowledgesIgnoredEvent() throws Exception {
            when(router.route(any(WebhookEvent.class))).thenReturn(WebhookEventRouter.Outcome.IGNORED);

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DELETE_EVENT))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ignored"));
        }

        @Test
        void failureAsksForRedelivery() throws Exception {
            when(router.route(any(WebhookEvent.class))).thenThrow(new DatabaseException("down", null));

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DELETE_EVENT))
                    .andExpect(status().isInternalServerError());
        }

        @Test
        void foreignSubscriptionIsForbidden() throws Exception {
            when(router.route(any(WebhookEvent.class))).thenThrow(new ForeignSubscriptionException(999L));

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DELETE_EVENT))
                    .andExpect(status().isForbidden());
        }

        @Test
        void missingOwnerCredentialAsksForRedelivery() throws Exception {
            when(router.route(any(WebhookEvent.class)))
                    .thenThrow(new AuthorizationException("No Strava credential for tenant 134815"));

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DELETE_EVENT))
                    .andExpect(status().isInternalServerError());
        }

        @Test
        void malformedEventIsBadRequest() throws Exception {
            when(router.route(any(WebhookEvent.class))).thenThrow(new IllegalArgumentException("missing owner_id"));

            mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content("{\"object_type\": \"activity\"}"))
                    .andExpect(status().isBadRequest());
        }
    }
}
