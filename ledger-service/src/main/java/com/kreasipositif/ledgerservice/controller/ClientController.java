package com.kreasipositif.ledgerservice.controller;

import com.kreasipositif.ledgerservice.dto.BinUpdateRequest;
import com.kreasipositif.ledgerservice.dto.BinUpdateResponse;
import com.kreasipositif.ledgerservice.dto.ClientDto;
import com.kreasipositif.ledgerservice.dto.CompanyDto;
import com.kreasipositif.ledgerservice.service.ClientDirectoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Clients and the organization's own identity.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Clients", description = "Client directory and company identity")
public class ClientController {

    private final ClientDirectoryService clientDirectoryService;

    @GetMapping(value = "/company", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Company identity",
            description = "BIN and IBAN used to tell outgoing payments from incoming ones.")
    public ResponseEntity<CompanyDto> company() {
        return ResponseEntity.ok(clientDirectoryService.company());
    }

    @GetMapping(value = "/clients", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List clients")
    public ResponseEntity<List<ClientDto>> clients() {
        return ResponseEntity.ok(clientDirectoryService.findAll());
    }

    @PatchMapping(
            value = "/clients/{id}/bin",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Backfill a client's BIN",
            description = """
                    Stores the BIN learned from a bank statement. A client that already has a BIN
                    keeps it and the response reports `updated: false`.
                    """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "BIN stored or left unchanged",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = BinUpdateResponse.class)
                    )
            ),
            @ApiResponse(responseCode = "404", description = "Unknown client")
    })
    public ResponseEntity<BinUpdateResponse> backfillBin(@PathVariable("id") String id,
                                                         @Valid @RequestBody BinUpdateRequest request) {
        return clientDirectoryService.backfillBin(id, request.getBin())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
