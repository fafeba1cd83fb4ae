package com.kreasipositif.ledgerservice.controller;

import com.kreasipositif.ledgerservice.dto.BulkAppendRequest;
import com.kreasipositif.ledgerservice.dto.BulkAppendResponse;
import com.kreasipositif.ledgerservice.dto.LedgerTransactionDto;
import com.kreasipositif.ledgerservice.service.LedgerTransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/ledger/transactions")
@RequiredArgsConstructor
@Tag(
        name = "Ledger Transactions",
        description = """
                Ledger entries. Statement commits create new entries or settle manually entered ones.
                """
)
public class LedgerTransactionController {

    private final LedgerTransactionService ledgerTransactionService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List ledger transactions")
    public ResponseEntity<List<LedgerTransactionDto>> findAll() {
        return ResponseEntity.ok(ledgerTransactionService.findAll());
    }

    @PostMapping(
            value = "/bulk",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Commit statement rows",
            description = """
                    Writes every draft in one call. A draft with `linkedTransactionId` settles that
                    entry (`VERIFIED` when amounts agree, `DISCREPANCY` otherwise) and records the bank
                    amount; any other draft becomes a new `BANK_IMPORT` entry.
                    
                    This endpoint is called by the **statement-processor** commit service.
                    """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "All drafts written",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = BulkAppendResponse.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request — empty list, missing fields or unknown client",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)
            )
    })
    public ResponseEntity<BulkAppendResponse> append(@Valid @RequestBody BulkAppendRequest request) {
        return ResponseEntity.ok(ledgerTransactionService.append(request));
    }

    @PostMapping(value = "/{id}/apply-bank-amount", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Accept the bank amount",
            description = "Replaces the booked amount of a settled entry with the bank amount and marks it `VERIFIED`."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Amount replaced"),
            @ApiResponse(responseCode = "404", description = "Unknown entry"),
            @ApiResponse(responseCode = "409", description = "The entry has not been settled by a bank row")
    })
    public ResponseEntity<LedgerTransactionDto> applyBankAmount(@PathVariable("id") String id) {
        return ledgerTransactionService.applyBankAmount(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected ledger write: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
