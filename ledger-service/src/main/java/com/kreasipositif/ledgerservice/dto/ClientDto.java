package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "A client of the organization")
public class ClientDto {

    @Schema(description = "Client id", example = "c-001")
    private final String id;

    @Schema(description = "Contact or display name", example = "Aruzhan Bekova")
    private final String name;

    @Schema(description = "Registered company name", example = "ТОО Алма Трейд")
    private final String company;

    @Schema(description = "12-digit BIN/IIN; empty when not yet known", example = "180540012345")
    private final String bin;
}
