package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.api.dto.response.ChunkPageResponse;
import com.flamingo.ai.ephemeralrag.api.dto.response.SessionResponse;
import com.flamingo.ai.ephemeralrag.service.export.ChunkExportService;
import com.flamingo.ai.ephemeralrag.service.export.ChunkView;
import com.flamingo.ai.ephemeralrag.service.export.ExportFormat;
import com.flamingo.ai.ephemeralrag.service.export.SessionExport;
import com.flamingo.ai.ephemeralrag.service.session.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/** REST controller for inspecting, browsing, exporting and deleting sessions. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

  private final SessionService sessionService;
  private final ChunkExportService chunkExportService;

  /** Gets a session by ID without extending its lifetime. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
    return ResponseEntity.ok(SessionResponse.fromInfo(sessionService.getSession(sessionId)));
  }

  /** Deletes a session. Succeeds for unknown sessions. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
    sessionService.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }

  /** Lists a page of stored chunks. */
  @GetMapping("/{sessionId}/chunks")
  public ResponseEntity<ChunkPageResponse> listChunks(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(defaultValue = "20") int limit,
      @RequestParam(required = false) String kind,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "false") boolean includeVectors) {
    return ResponseEntity.ok(
        ChunkPageResponse.fromPage(
            chunkExportService.listChunks(
                sessionId,
                offset,
                limit,
                RequestParams.contentKind(kind),
                search,
                includeVectors)));
  }

  /** Gets one chunk by its insertion index. */
  @GetMapping("/{sessionId}/chunks/{chunkIndex}")
  public ResponseEntity<ChunkView> getChunk(
      @PathVariable String sessionId,
      @PathVariable int chunkIndex,
      @RequestParam(defaultValue = "true") boolean includeVector) {
    return ResponseEntity.ok(chunkExportService.getChunk(sessionId, chunkIndex, includeVector));
  }

  /** Streams every chunk of the session as JSON lines or a JSON array. */
  @GetMapping("/{sessionId}/export")
  public ResponseEntity<StreamingResponseBody> export(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "jsonl") String format,
      @RequestParam(required = false) String kind,
      @RequestParam(defaultValue = "true") boolean includeVectors) {
    SessionExport export =
        chunkExportService.openExport(
            sessionId,
            includeVectors,
            RequestParams.contentKind(kind),
            ExportFormat.fromValue(format));

    StreamingResponseBody body =
        out -> {
          int written = export.writeTo(out);
          log.debug("Streamed {} records of session {}", written, sessionId);
        };
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(export.getFormat().getMediaType()))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"" + export.getFileName() + "\"")
        .body(body);
  }
}
