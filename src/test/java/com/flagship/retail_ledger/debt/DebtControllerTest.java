package com.flagship.retail_ledger.debt;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DebtControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Overdue payable is flagged and can be paid in parts")
    void testPayableLifecycle() throws Exception {
        LocalDate today = LocalDate.now();
        String body = String.format("{\"description\": \"Fabric rolls\", \"counterparty\": \"Telas Norte\", "
            + "\"amount\": 1000, \"invoice_date\": \"%s\", \"due_date\": \"%s\"}",
            today.minusDays(30), today.minusDays(1));

        String response = mockMvc.perform(post("/api/payables")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("payable"))
            .andExpect(jsonPath("$.is_overdue").value(true))
            .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(response).get("id").asText();

        mockMvc.perform(post("/api/payables/{id}/pay", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 400, \"method\": \"cash\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_paid").value(false));

        mockMvc.perform(post("/api/payables/{id}/pay", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 700}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payables/{id}/pay", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 600}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_paid").value(true))
            .andExpect(jsonPath("$.is_overdue").value(false));

        mockMvc.perform(get("/api/receivables/{id}", id))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/payables").param("pending", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + id + "')]").isEmpty());
    }
}
