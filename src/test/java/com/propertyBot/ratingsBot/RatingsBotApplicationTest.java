package com.propertyBot.ratingsBot;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RatingsBotApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldAnswerStartWithMainMenu() throws Exception {
        mockMvc.perform(post("/api/v1/bot/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Chat-ID", "100200300")
                        .content("{\"text\":\"/start\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correlationId").isNotEmpty())
                .andExpect(jsonPath("$.messages[0].type").value("MENU"))
                .andExpect(jsonPath("$.messages[0].keyboard[0][0].callbackData").value("action_top5"))
                .andExpect(jsonPath("$.messages[0].keyboard[2][1].label").value("📋 Complaints"));
    }

    @Test
    void shouldAnswerHelpButton() throws Exception {
        mockMvc.perform(post("/api/v1/bot/callbacks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Chat-ID", "100200301")
                        .content("{\"data\":\"action_property_help\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].type").value("TEXT"));
    }
}
