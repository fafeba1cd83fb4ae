package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@Schema(description = "Result of a bulk commit")
public class BulkAppendResponse {

    @Schema(description = "New entries created", example = "7")
    private final int totalCreated;

    @Schema(description = "Existing entries settled by a linked row", example = "2")
    private final int totalLinked;

    @Schema(description = "Id of the entry each draft was written to, in request order")
    private final List<String> entryIds;
}
