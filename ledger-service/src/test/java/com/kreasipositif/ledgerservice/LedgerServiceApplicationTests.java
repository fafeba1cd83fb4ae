package com.kreasipositif.ledgerservice;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract the statement-processor relies on: paths, field names and error statuses.
 */
@SpringBootTest
@AutoConfigureMockMvc
class LedgerServiceApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void companyEndpointReturnsIdentity() throws Exception {
        mockMvc.perform(get("/api/v1/ledger/company"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bin").value("990140001122"))
                .andExpect(jsonPath("$.iban").value("KZ86125KZT5004100100"));
    }

    @Test
    void clientsEndpointListsSeed() throws Exception {
        mockMvc.perform(get("/api/v1/ledger/clients"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[0].id").value("1"))
                .andExpect(jsonPath("$[0].bin").value("180540012345"));
    }

    @Test
    void transactionsExposeReconciliationFields() throws Exception {
        mockMvc.perform(get("/api/v1/ledger/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("t-100"))
                .andExpect(jsonPath("$[0].date").value("2026-03-02"))
                .andExpect(jsonPath("$[0].direction").value("INCOME"))
                .andExpect(jsonPath("$[0].reconciliationStatus").value("MANUAL"));
    }

    @Test
    @DirtiesContext
    void bulkAppendReturnsEntryIds() throws Exception {
        String body = """
                {"entries":[{"clientId":"1","amount":10000.00,"date":"2026-03-03","direction":"INCOME",
                  "paymentType":"FULL_PAYMENT","description":"[BANK:IN] [DOC:77]","bankDocumentNumber":"77",
                  "bankClientName":"ТОО Алма Трейд","linkedTransactionId":"t-100"}]}
                """;
        mockMvc.perform(post("/api/v1/ledger/transactions/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalLinked").value(1))
                .andExpect(jsonPath("$.entryIds[0]").value("t-100"));
    }

    @Test
    void bulkAppendWithUnknownClientIsBadRequest() throws Exception {
        String body = """
                {"entries":[{"clientId":"404","amount":1,"direction":"INCOME"}]}
                """;
        mockMvc.perform(post("/api/v1/ledger/transactions/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("unknown client: 404"));
    }

    @Test
    void applyBankAmountOnManualEntryIsConflict() throws Exception {
        mockMvc.perform(post("/api/v1/ledger/transactions/t-100/apply-bank-amount"))
                .andExpect(status().isConflict());
    }

    @Test
    @DirtiesContext
    void aliasUpsertReportsChange() throws Exception {
        String body = """
                {"bankName":"ИП КАСЫМОВА Д.","bankBin":"","clientId":"2"}
                """;
        mockMvc.perform(put("/api/v1/ledger/aliases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
    }

    @Test
    void binBackfillForUnknownClientIsNotFound() throws Exception {
        mockMvc.perform(patch("/api/v1/ledger/clients/nope/bin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bin\":\"123456789012\"}"))
                .andExpect(status().isNotFound());
    }
}
