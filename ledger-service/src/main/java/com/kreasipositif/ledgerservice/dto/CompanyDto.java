package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Identity of the organization that owns the statements")
public class CompanyDto {

    @Schema(description = "Organization BIN", example = "990140001122")
    private final String bin;

    @Schema(description = "Settlement account", example = "KZ86125KZT5004100100")
    private final String iban;
}
