package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.api.dto.request.IngestRequest;
import com.flamingo.ai.ephemeralrag.api.dto.response.IngestResponse;
import com.flamingo.ai.ephemeralrag.service.ingest.IngestionResult;
import com.flamingo.ai.ephemeralrag.service.ingest.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingesting extracted passages. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestionController {

  public static final String USER_HEADER = "X-User-Id";

  private final IngestionService ingestionService;

  /** Embeds and stores passages; creates a session when none is given. */
  @PostMapping
  public ResponseEntity<IngestResponse> ingest(
      @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody IngestRequest request) {
    IngestionResult result =
        ingestionService.ingest(userId, request.getSessionId(), request.toDrafts());
    HttpStatus status = result.newSession() ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(IngestResponse.fromResult(result));
  }
}
