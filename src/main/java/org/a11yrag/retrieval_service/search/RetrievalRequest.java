package org.a11yrag.retrieval_service.search;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/** Retrieval request as received from a caller. */
@Schema(description = "Retrieval request")
public record RetrievalRequest(
    @Schema(description = "Free-text query", example = "how to fix color contrast issues")
        @NotBlank
        @Size(max = 1000)
        String query,
    @Schema(description = "Restrict the search to one document type", example = "standards")
        String documentType,
    @Schema(description = "Skip classification and use this intent", example = "IMPLEMENTATION")
        String intent,
    @Schema(description = "Request deadline in milliseconds") @Positive @Max(60_000)
        Long timeoutMs,
    @Schema(description = "Maximum number of results") @Positive @Max(100) Integer resultCount) {

  public static RetrievalRequest of(String query) {
    return new RetrievalRequest(query, null, null, null, null);
  }
}
