package com.kreasipositif.statementprocessor.controller;

import com.kreasipositif.statementprocessor.domain.ImportResult;
import com.kreasipositif.statementprocessor.parser.UnsupportedStatementFormatException;
import com.kreasipositif.statementprocessor.service.CommitReport;
import com.kreasipositif.statementprocessor.service.CommitRequest;
import com.kreasipositif.statementprocessor.service.ImportCommitService;
import com.kreasipositif.statementprocessor.service.StatementImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Interactive import: upload a statement, review the result, then commit the chosen rows.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/statements")
@RequiredArgsConstructor
@Tag(
        name = "Statement Import",
        description = """
                Parses a bank statement, matches counterparties to clients and reconciles the rows
                against the ledger. Nothing is written until the reviewed result is committed.
                """
)
public class StatementImportController {

    private final StatementImportService statementImportService;
    private final ImportCommitService importCommitService;

    @PostMapping(
            value = "/import",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Import a statement file",
            description = """
                    Detects the format (1C exchange text, delimited text or spreadsheet), parses every
                    movement and returns the transactions with their match and reconciliation outcome.
                    
                    Rows flagged as duplicates of earlier imports are returned but excluded from the totals.
                    """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Statement parsed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ImportResult.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "No grammar recognizes the file",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)
            )
    })
    public ResponseEntity<ImportResult> importStatement(@RequestParam("file") MultipartFile file) throws IOException {
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        log.info("Import request for '{}' ({} bytes)", fileName, file.getSize());
        return ResponseEntity.ok(statementImportService.importStatement(fileName, file.getBytes()));
    }

    @PostMapping(
            value = "/commit",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Commit a reviewed import",
            description = """
                    Appends the selected rows to the ledger. Rows linked to an existing entry settle it;
                    manual client choices and name matches are remembered as counterparty aliases.
                    
                    When `selectedRows` is omitted every non-duplicate row is committed.
                    """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Commit finished",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CommitReport.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request — result is missing",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)
            )
    })
    public ResponseEntity<CommitReport> commit(@Valid @RequestBody CommitBody body) {
        CommitReport report = importCommitService.commit(
                body.result(), new CommitRequest(body.selectedRows(), body.clientOverrides()));
        return ResponseEntity.ok(report);
    }

    @ExceptionHandler(UnsupportedStatementFormatException.class)
    public ResponseEntity<Map<String, String>> handleUnsupported(UnsupportedStatementFormatException e) {
        log.warn("Rejected '{}': {}", e.getFileName(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", UnsupportedStatementFormatException.FORMAT_NOT_RECOGNIZED));
    }

    /**
     * @param result          the result previously returned by {@code /import}
     * @param selectedRows    row indices to commit; omitted means the default selection
     * @param clientOverrides row index to client id
     */
    public record CommitBody(@NotNull ImportResult result,
                             List<Integer> selectedRows,
                             Map<Integer, String> clientOverrides) {}
}
