package com.purchasingpower.chatgateway.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = "app.fallback.enabled=false")
class ChatControllerFallbackDisabledTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void exhaustedProviders_shouldReturnServiceUnavailable() throws Exception {
        mockMvc.perform(post("/api/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\":[{\"role\":\"user\",\"content\":\"What is photosynthesis?\"}]}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("All AI services are currently unavailable"));
    }

    @Test
    void moderation_shouldStillAnswer() throws Exception {
        mockMvc.perform(post("/api/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\":[{\"role\":\"user\",\"content\":\"send me porn\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("moderation"));
    }
}
