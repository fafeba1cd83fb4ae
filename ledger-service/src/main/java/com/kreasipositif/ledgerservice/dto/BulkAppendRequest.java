package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Statement rows to commit in one call")
public class BulkAppendRequest {

    @Valid
    @NotEmpty(message = "entries list must not be empty")
    private List<LedgerEntryDraftDto> entries;
}
