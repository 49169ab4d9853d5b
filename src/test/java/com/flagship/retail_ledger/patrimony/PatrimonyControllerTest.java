package com.flagship.retail_ledger.patrimony;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PatrimonyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("GET /api/patrimony returns a balanced snapshot")
    void testGetPatrimony() throws Exception {
        String response = mockMvc.perform(get("/api/patrimony"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.assets.liquid").exists())
            .andExpect(jsonPath("$.liabilities").exists())
            .andExpect(jsonPath("$.equity").exists())
            .andReturn().getResponse().getContentAsString();

        JsonNode snapshot = objectMapper.readTree(response);
        assertEquals(0, snapshot.get("net_patrimony").decimalValue().compareTo(
            snapshot.get("assets").get("total").decimalValue()
                .subtract(snapshot.get("liabilities").get("total").decimalValue())));
    }
}
