package org.a11yrag.retrieval_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.model.AuthoritySnapshot;
import org.a11yrag.retrieval_service.authority.service.AuthorityService;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.OntologyStats;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative snapshot refresh. A failed reload leaves the previous snapshot serving and is
 * reported through the global exception handler.
 *
 * <p><b>Security:</b> unsecured; restrict at the network level.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Administration", description = "Reload ontology and authority snapshots")
public class AdminController {

  private final OntologyService ontologyService;
  private final AuthorityService authorityService;

  public AdminController(OntologyService ontologyService, AuthorityService authorityService) {
    this.ontologyService = ontologyService;
    this.authorityService = authorityService;
  }

  @Operation(summary = "Reload, validate and swap the ontology snapshot")
  @PostMapping(value = "/ontology/reload", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<OntologyStats>> reloadOntology() {
    log.info("Ontology reload requested");
    OntologyGraph graph = ontologyService.loadOntology();
    return ResponseEntity.ok(
        RestResponse.success("Ontology " + graph.getVersion() + " loaded", graph.stats()));
  }

  @Operation(summary = "Reload and swap the authority records snapshot")
  @PostMapping(value = "/authority/reload", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<Map<String, Object>>> reloadAuthority() {
    log.info("Authority records reload requested");
    AuthoritySnapshot snapshot = authorityService.loadRecords();
    return ResponseEntity.ok(
        RestResponse.success(
            "Authority records " + snapshot.getVersion() + " loaded",
            Map.of("version", snapshot.getVersion(), "authors", snapshot.size())));
  }
}
