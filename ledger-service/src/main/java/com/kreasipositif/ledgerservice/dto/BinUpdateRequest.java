package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "BIN learned from a bank statement")
public class BinUpdateRequest {

    @NotBlank(message = "bin must not be blank")
    @Schema(example = "180540012345", requiredMode = Schema.RequiredMode.REQUIRED)
    private String bin;
}
