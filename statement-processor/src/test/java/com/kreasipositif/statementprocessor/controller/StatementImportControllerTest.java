package com.kreasipositif.statementprocessor.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kreasipositif.statementprocessor.domain.ImportResult;
import com.kreasipositif.statementprocessor.parser.UnsupportedStatementFormatException;
import com.kreasipositif.statementprocessor.service.CommitReport;
import com.kreasipositif.statementprocessor.service.CommitRequest;
import com.kreasipositif.statementprocessor.service.ImportCommitService;
import com.kreasipositif.statementprocessor.service.ReferenceDataService;
import com.kreasipositif.statementprocessor.service.StatementImportService;
import com.kreasipositif.statementprocessor.service.TestLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StatementImportController.class)
class StatementImportControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @MockitoBean private StatementImportService statementImportService;
    @MockitoBean private ImportCommitService importCommitService;

    // ─── POST /api/v1/statements/import ──────────────────────────────────────

    @Test
    @DisplayName("Upload returns the parsed transactions and summary")
    void import_ok() throws Exception {
        byte[] content = TestLedger.fixture("national-march.txt");
        ImportResult result = parse("national-march.txt");
        when(statementImportService.importStatement(eq("national-march.txt"), any())).thenReturn(result);

        mockMvc.perform(multipart("/api/v1/statements/import")
                        .file(new MockMultipartFile("file", "national-march.txt", "text/plain", content)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("NATIONAL_TXT"))
                .andExpect(jsonPath("$.transactions.length()").value(3))
                .andExpect(jsonPath("$.transactions[2].currency").value("USD"))
                .andExpect(jsonPath("$.summary.total").value(3));
    }

    @Test
    @DisplayName("Unrecognized upload is answered with 422 and a fixed error message")
    void import_unrecognized() throws Exception {
        when(statementImportService.importStatement(eq("cover-letter.txt"), any()))
                .thenThrow(new UnsupportedStatementFormatException("cover-letter.txt", "no known grammar applies"));

        mockMvc.perform(multipart("/api/v1/statements/import")
                        .file(new MockMultipartFile("file", "cover-letter.txt", "text/plain", "Dear customer".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("format not recognized"));
    }

    // ─── POST /api/v1/statements/commit ──────────────────────────────────────

    @Test
    @DisplayName("Commit passes the reviewed result, selection and overrides through")
    void commit_ok() throws Exception {
        ImportResult result = parse("delimited-march.csv");
        when(importCommitService.commit(any(), any())).thenReturn(new CommitReport(2, 1, 0, 1, 0, List.of()));
        String body = objectMapper.writeValueAsString(Map.of(
                "result", result,
                "selectedRows", List.of(0, 2),
                "clientOverrides", Map.of("2", "2")));

        mockMvc.perform(post("/api/v1/statements/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.committed").value(2))
                .andExpect(jsonPath("$.aliasesLearned").value(1));

        ArgumentCaptor<ImportResult> sent = ArgumentCaptor.forClass(ImportResult.class);
        ArgumentCaptor<CommitRequest> request = ArgumentCaptor.forClass(CommitRequest.class);
        verify(importCommitService).commit(sent.capture(), request.capture());
        assertThat(sent.getValue().getTransactions()).hasSize(3);
        assertThat(sent.getValue().getTransactions().get(0).getReconciliation().existingTransaction().id())
                .isEqualTo("t-100");
        assertThat(request.getValue().selectedRows()).containsExactly(0, 2);
        assertThat(request.getValue().clientOverrides()).containsEntry(2, "2");
    }

    @Test
    @DisplayName("Commit without a result is rejected with 400")
    void commit_missingResult() throws Exception {
        mockMvc.perform(post("/api/v1/statements/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectedRows\":[0]}"))
                .andExpect(status().isBadRequest());
    }

    private static ImportResult parse(String fixture) throws IOException {
        return TestLedger.importService(mock(ReferenceDataService.class))
                .importStatement(fixture, TestLedger.fixture(fixture), TestLedger.context());
    }
}
