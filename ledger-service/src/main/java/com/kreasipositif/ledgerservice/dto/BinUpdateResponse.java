package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Result of a BIN backfill")
public class BinUpdateResponse {

    private final String clientId;

    @Schema(description = "The client's BIN after the call")
    private final String bin;

    @Schema(description = "false when the client already had a BIN")
    private final boolean updated;
}
