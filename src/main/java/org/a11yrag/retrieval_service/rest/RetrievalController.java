package org.a11yrag.retrieval_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.search.RetrievalPipeline;
import org.a11yrag.retrieval_service.search.RetrievalRequest;
import org.a11yrag.retrieval_service.search.RetrievalResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Retrieval API v1. Failures are mapped by the global exception handler. */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(
    name = "Retrieval",
    description =
        """
        Ontology-expanded, authority-weighted retrieval over the partitioned knowledge base.
        Returns RestResponse<T> envelopes with consistent success/error structure.
        """)
public class RetrievalController {

  private final RetrievalPipeline retrievalPipeline;

  public RetrievalController(RetrievalPipeline retrievalPipeline) {
    this.retrievalPipeline = retrievalPipeline;
  }

  @Operation(
      summary = "Retrieve ranked passages",
      description =
          """
          Classifies the query, expands it through the ontology, searches the routed partitions
          concurrently and returns fused, deduplicated results. A partial fan-out is reported
          with degraded=true.""")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Ranked results, possibly degraded",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "400",
        description = "Blank query or unknown document type / intent",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "503",
        description = "Every partition search failed or timed out",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "504",
        description = "Deadline passed before the search started",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  @PostMapping(
      value = "/retrieve",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<RetrievalResponse>> retrieve(
      @Valid @RequestBody RetrievalRequest request) {
    RetrievalResponse response = retrievalPipeline.retrieve(request);
    return ResponseEntity.ok(RestResponse.success(message(response), response));
  }

  /** Query-string form of {@link #retrieve(RetrievalRequest)}. */
  @Operation(summary = "Retrieve ranked passages (query-string form)")
  @GetMapping(value = "/retrieve", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<RetrievalResponse>> retrieveGet(
      @Parameter(description = "Free-text query", example = "how to fix color contrast issues")
          @RequestParam(defaultValue = "")
          String query,
      @Parameter(description = "Document type filter", example = "standards")
          @RequestParam(required = false)
          String documentType,
      @Parameter(description = "Intent override", example = "STANDARDS")
          @RequestParam(required = false)
          String intent,
      @RequestParam(required = false) Long timeoutMs,
      @RequestParam(required = false) Integer resultCount) {
    RetrievalResponse response =
        retrievalPipeline.retrieve(
            new RetrievalRequest(query, documentType, intent, timeoutMs, resultCount));
    return ResponseEntity.ok(RestResponse.success(message(response), response));
  }

  private static String message(RetrievalResponse response) {
    return String.format(
        "%d results (%s)%s",
        response.results().size(),
        response.intent(),
        response.degraded() ? ", degraded" : "");
  }
}
