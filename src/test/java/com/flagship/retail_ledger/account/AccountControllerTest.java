package com.flagship.retail_ledger.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createAccount(String code, String kind, String openingBalance) throws Exception {
        String body = String.format(
            "{\"code\": \"%s\", \"name\": \"Account %s\", \"kind\": \"%s\", \"opening_balance\": %s}",
            code, code, kind, openingBalance);
        String response = mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value(kind))
            .andExpect(jsonPath("$.active").value(true))
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asText();
    }

    private static String newCode() {
        return "T" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    @DisplayName("Accounts can be created, read and listed")
    void testCreateGetList() throws Exception {
        String code = newCode();
        String id = createAccount(code, "bank", "1500.25");

        String response = mockMvc.perform(get("/api/accounts/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(code))
            .andReturn().getResponse().getContentAsString();
        assertEquals(0, new BigDecimal("1500.25").compareTo(objectMapper.readTree(response).get("balance").decimalValue()));

        String list = mockMvc.perform(get("/api/accounts"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        boolean listed = false;
        for (JsonNode account : objectMapper.readTree(list)) {
            listed |= account.get("id").asText().equals(id);
        }
        assertTrue(listed);
    }

    @Test
    @DisplayName("Duplicate code and missing kind are rejected with 400")
    void testCreate_Validation() throws Exception {
        String code = newCode();
        createAccount(code, "digital_wallet", "0");

        mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"code\": \"%s\", \"name\": \"Dup\", \"kind\": \"bank\"}", code)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"code\": \"%s\", \"name\": \"No kind\"}", newCode())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.kind").value("Kind is required"));
    }

    @Test
    @DisplayName("Transfer, balance override and journal over HTTP")
    void testTransferSetBalanceEntries() throws Exception {
        String petty = createAccount(newCode(), "cash_primary", "300");
        String vault = createAccount(newCode(), "cash_secondary", "0");

        mockMvc.perform(post("/api/accounts/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format(
                    "{\"from_account_id\": \"%s\", \"to_account_id\": \"%s\", \"amount\": 300}", petty, vault)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.from.id").value(petty))
            .andExpect(jsonPath("$.to.id").value(vault));

        mockMvc.perform(post("/api/accounts/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format(
                    "{\"from_account_id\": \"%s\", \"to_account_id\": \"%s\", \"amount\": 1}", petty, vault)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"));

        mockMvc.perform(put("/api/accounts/{id}/balance", vault)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"balance\": 250, \"reason\": \"Counted vault at closing\"}"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/accounts/{id}/entries", vault))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[1].entry_type").value("CREDIT"))
            .andExpect(jsonPath("$[2].entry_type").value("BALANCE_SET"))
            .andExpect(jsonPath("$[2].description").value("Counted vault at closing"));
    }

    @Test
    @DisplayName("POST income credits the account; by payment method, credit sales are rejected")
    void testRecordIncome() throws Exception {
        String wallet = createAccount(newCode(), "digital_wallet", "10");

        mockMvc.perform(post("/api/accounts/{id}/income", wallet)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 90.25, \"description\": \"Nequi sale\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(100.25));

        mockMvc.perform(post("/api/accounts/{id}/income", wallet)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 0, \"description\": \"Nothing\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/accounts/income")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 15, \"payment_method\": \"credit\", \"description\": \"Sold on credit\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.field").value("payment_method"));
    }

    @Test
    @DisplayName("Override reason above 500 characters is rejected with 400, not a server error")
    void testSetBalance_ReasonTooLong() throws Exception {
        String bank = createAccount(newCode(), "bank", "10");

        mockMvc.perform(put("/api/accounts/{id}/balance", bank)
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"balance\": 5, \"reason\": \"%s\"}", "x".repeat(600))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("DELETE of an account holding money is rejected")
    void testDeactivate_NonZeroBalance() throws Exception {
        String bank = createAccount(newCode(), "bank", "1000");

        mockMvc.perform(delete("/api/accounts/{id}", bank))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/accounts/{id}", bank))
            .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    @DisplayName("DELETE deactivates an account")
    void testDeactivate() throws Exception {
        String id = createAccount(newCode(), "asset_other", "0");

        mockMvc.perform(delete("/api/accounts/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/accounts/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }
}
