package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A learned bank name/BIN to client mapping. Used both as upsert payload and in listings.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counterparty alias")
public class CounterpartyAliasDto {

    @Schema(description = "Counterparty name as the bank printed it", example = "ТОО \"АЛМА ТРЕЙД\"")
    private String bankName;

    @Schema(description = "Counterparty BIN from the statement; may be empty", example = "180540012345")
    private String bankBin;

    @NotBlank(message = "clientId must not be blank")
    @Schema(description = "Client the counterparty resolves to", example = "c-001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String clientId;
}
