package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Result of an alias upsert")
public class AliasUpsertResponse {

    private final String bankName;

    private final String bankBin;

    private final String clientId;

    @Schema(description = "false when the same alias was already stored")
    private final boolean changed;
}
