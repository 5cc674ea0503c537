package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.api.dto.request.BatchRetrieveRequest;
import com.flamingo.ai.ephemeralrag.api.dto.request.RetrieveRequest;
import com.flamingo.ai.ephemeralrag.api.dto.response.BatchRetrievalResponse;
import com.flamingo.ai.ephemeralrag.api.dto.response.RetrievalResponse;
import com.flamingo.ai.ephemeralrag.service.retrieval.RetrievalQuery;
import com.flamingo.ai.ephemeralrag.service.retrieval.RetrievalService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for similarity retrieval. */
@RestController
@RequestMapping("/api/retrieve")
@RequiredArgsConstructor
public class RetrievalController {

  private final RetrievalService retrievalService;

  /** Ranks a session's chunks against one query. */
  @PostMapping
  public ResponseEntity<RetrievalResponse> retrieve(@Valid @RequestBody RetrieveRequest request) {
    return ResponseEntity.ok(
        RetrievalResponse.fromResult(retrievalService.retrieve(request.toQuery())));
  }

  /** Runs several queries, reporting failures per query. */
  @PostMapping("/batch")
  public ResponseEntity<BatchRetrievalResponse> retrieveBatch(
      @Valid @RequestBody BatchRetrieveRequest request) {
    List<RetrievalQuery> queries =
        request.getQueries().stream().map(RetrieveRequest::toQuery).toList();
    return ResponseEntity.ok(
        BatchRetrievalResponse.fromResults(retrievalService.retrieveBatch(queries)));
  }
}
