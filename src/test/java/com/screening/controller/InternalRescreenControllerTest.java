package com.screening.controller;

import com.screening.config.ScreeningProperties;
import com.screening.exception.BatchAlreadyRunningException;
import com.screening.service.RescreenBatchResult;
import com.screening.service.RescreenScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InternalRescreenController.class)
@Import({SharedSecretVerifier.class, InternalRescreenControllerTest.SecretConfig.class})
@DisplayName("InternalRescreenController")
class InternalRescreenControllerTest {

    @TestConfiguration
    static class SecretConfig {
        @Bean
        ScreeningProperties screeningProperties() {
            ScreeningProperties properties = new ScreeningProperties();
            properties.getInternal().setSharedSecret("s3cret-value");
            return properties;
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RescreenScheduler rescreenScheduler;

    @Test
    @DisplayName("Should run the batch and return its counts for a valid secret")
    void shouldRunBatch() throws Exception {
        // Given
        when(rescreenScheduler.runBatch("internal")).thenReturn(new RescreenBatchResult(
                "batch-1", "internal", 100, 99, 12, 1, 1, "ofac@v1",
                Instant.parse("2026-10-19T02:00:00Z"), Instant.parse("2026-10-19T02:05:00Z")));

        // When / Then
        mockMvc.perform(post("/internal/rescreen").header(HttpHeaders.AUTHORIZATION, "Bearer s3cret-value"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed_count").value(99))
                .andExpect(jsonPath("$.updated_count").value(12))
                .andExpect(jsonPath("$.alerts_generated_count").value(1))
                .andExpect(jsonPath("$.failed_count").value(1));
    }

    @Test
    @DisplayName("Should answer 401 without touching the batch when the secret is wrong")
    void shouldRejectWrongSecret() throws Exception {
        mockMvc.perform(post("/internal/rescreen").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));

        mockMvc.perform(post("/internal/rescreen"))
                .andExpect(status().isUnauthorized());

        verify(rescreenScheduler, never()).runBatch("internal");
    }

    @Test
    @DisplayName("Should answer 409 while another batch is running")
    void shouldRejectConcurrentBatch() throws Exception {
        when(rescreenScheduler.runBatch("internal")).thenThrow(new BatchAlreadyRunningException());

        mockMvc.perform(post("/internal/rescreen").header(HttpHeaders.AUTHORIZATION, "Bearer s3cret-value"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("BATCH_ALREADY_RUNNING"));
    }
}
