package com.kreasipositif.ledgerservice.controller;

import com.kreasipositif.ledgerservice.dto.AliasUpsertResponse;
import com.kreasipositif.ledgerservice.dto.CounterpartyAliasDto;
import com.kreasipositif.ledgerservice.service.ClientDirectoryService;
import com.kreasipositif.ledgerservice.service.CounterpartyAliasService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ledger/aliases")
@RequiredArgsConstructor
@Tag(name = "Counterparty Aliases", description = "Bank name/BIN to client mappings learned on commit")
public class CounterpartyAliasController {

    private final CounterpartyAliasService counterpartyAliasService;
    private final ClientDirectoryService clientDirectoryService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List aliases")
    public ResponseEntity<List<CounterpartyAliasDto>> findAll() {
        return ResponseEntity.ok(counterpartyAliasService.findAll());
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Upsert an alias",
            description = """
                    Keyed by BIN when present, otherwise by the lower-cased bank name. Storing an alias
                    that already resolves to the same client returns `changed: false`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alias stored or already present"),
            @ApiResponse(responseCode = "400", description = "Unknown client, or neither name nor BIN given")
    })
    public ResponseEntity<AliasUpsertResponse> upsert(@Valid @RequestBody CounterpartyAliasDto request) {
        if (!clientDirectoryService.exists(request.getClientId())) {
            throw new IllegalArgumentException("unknown client: " + request.getClientId());
        }
        return ResponseEntity.ok(counterpartyAliasService.upsert(request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
