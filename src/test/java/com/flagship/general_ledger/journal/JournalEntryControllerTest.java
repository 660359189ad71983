package com.flagship.general_ledger.journal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.general_ledger.AbstractIntegrationTest;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.period.FiscalPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST contract of /api/journal-entries: status codes, idempotent creation
 * and the error body returned for each failure class.
 */
@AutoConfigureMockMvc
class JournalEntryControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Account cash;
    private Account sales;
    private FiscalPeriod january;

    @BeforeEach
    void setUp() {
        cash = createAccount("1100", "Cash", AccountType.ASSET);
        sales = createAccount("4100", "Sales", AccountType.REVENUE);
        january = openPeriod(2026, 1);
    }

    private Map<String, Object> line(UUID accountId, String direction, long amount) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("account_id", accountId);
        line.put("direction", direction);
        line.put("amount", amount);
        return line;
    }

    private String entryJson(String entryDate, long debit, long credit) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entry_date", entryDate);
        body.put("description", "Cash sale");
        body.put("entry_type", "MANUAL");
        body.put("created_by", "clerk");
        body.put("lines", List.of(
            line(cash.getId(), "DEBIT", debit),
            line(sales.getId(), "CREDIT", credit)));
        return objectMapper.writeValueAsString(body);
    }

    @Test
    @DisplayName("Same Idempotency-Key returns the original entry")
    void testCreateEntry_Idempotent() throws Exception {
        printTestHeader("Create Entry - Idempotent");

        String idempotencyKey = UUID.randomUUID().toString();
        String request = entryJson("2026-01-05T10:00:00Z", 25_000, 25_000);
        printInput("Idempotency Key", idempotencyKey);

        String first = mockMvc.perform(post("/api/journal-entries")
                .header("Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.entry_date").value("2026-01-05"))
            .andExpect(jsonPath("$.total_debits").value(25_000))
            .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(post("/api/journal-entries")
                .header("Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        JsonNode firstBody = objectMapper.readTree(first);
        JsonNode secondBody = objectMapper.readTree(second);
        printOutput("First ID", firstBody.get("id").asText());
        printOutput("Second ID", secondBody.get("id").asText());

        assertEquals(firstBody.get("id").asText(), secondBody.get("id").asText());
        assertEquals(1, countRows("journal_entries"));

        printSuccess("Repeated key returned the same entry");
    }

    @Test
    @DisplayName("Unbalanced and malformed requests are rejected with 400")
    void testCreateEntry_BadRequests() throws Exception {
        printTestHeader("Create Entry - Bad Requests");

        mockMvc.perform(post("/api/journal-entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("2026-01-05", 100, 90)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/journal-entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("05/01/2026", 100, 100)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/journal-entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("2026-01-05", 0, 0)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details").exists());

        assertEquals(0, countRows("journal_entries"));
        printSuccess("Bad requests rejected without writes");
    }

    @Test
    @DisplayName("Posting into a CLOSED period returns 409 PERIOD_CLOSED")
    void testPostEntry_PeriodClosed() throws Exception {
        printTestHeader("Post Entry - Period Closed");

        String created = mockMvc.perform(post("/api/journal-entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryJson("2026-01-20", 800, 800)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String entryId = objectMapper.readTree(created).get("id").asText();

        mockMvc.perform(post("/api/fiscal-periods/{id}/close", january.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"performed_by\":\"controller\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CLOSED"));

        mockMvc.perform(post("/api/journal-entries/{id}/post", entryId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"posted_by\":\"clerk\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PERIOD_CLOSED"));

        printSuccess("Closed period returned 409");
    }

    @Test
    @DisplayName("Unknown entry returns 404 and carries the correlation ID")
    void testGetEntry_NotFound() throws Exception {
        printTestHeader("Get Entry - Not Found");

        mockMvc.perform(get("/api/journal-entries/{id}", UUID.randomUUID())
                .header("X-Correlation-ID", "test-correlation-1"))
            .andExpect(status().isNotFound())
            .andExpect(header().string("X-Correlation-ID", "test-correlation-1"))
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        printSuccess("404 returned");
    }
}
