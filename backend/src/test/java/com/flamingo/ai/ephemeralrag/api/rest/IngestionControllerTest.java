package com.flamingo.ai.ephemeralrag.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkDraft;
import com.flamingo.ai.ephemeralrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.ephemeralrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.ephemeralrag.exception.QuotaExceededException;
import com.flamingo.ai.ephemeralrag.service.ingest.IngestionResult;
import com.flamingo.ai.ephemeralrag.service.ingest.IngestionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionController Tests")
class IngestionControllerTest {

  private static final Instant RESET = Instant.parse("2026-01-02T00:00:00Z");
  private static final Instant EXPIRES = Instant.parse("2026-01-01T01:00:00Z");

  private static final String BODY =
      """
      {
        "chunks": [
          {"text": "Revenue grew 10%", "metadata": {"sourceId": "q3.pdf", "position": 2}},
          {"text": "| a | b |", "metadata": {"filename": "q3.pdf", "page": 3, "type": "table"}}
        ]
      }
      """;

  @Mock private IngestionService ingestionService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new IngestionController(ingestionService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should create a session and return 201")
  @SuppressWarnings("unchecked")
  void shouldReturnCreated_whenNewSession() throws Exception {
    // Given
    when(ingestionService.ingest(eq("alice"), isNull(), anyList()))
        .thenReturn(new IngestionResult("s-1", true, 2, 2, 1998, RESET, EXPIRES));

    // When / Then
    mockMvc
        .perform(
            post("/api/ingest")
                .header(IngestionController.USER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.sessionId").value("s-1"))
        .andExpect(jsonPath("$.chunksStored").value(2))
        .andExpect(jsonPath("$.quotaRemaining").value(1998));

    ArgumentCaptor<List<ChunkDraft>> drafts = ArgumentCaptor.forClass(List.class);
    verify(ingestionService).ingest(eq("alice"), isNull(), drafts.capture());
    ChunkDraft table = drafts.getValue().get(1);
    assertThat(table.metadata().kind()).isEqualTo(ContentKind.TABLE);
    assertThat(table.metadata().position()).isEqualTo(3);
    assertThat(table.sequence()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should return 400 when the user header is missing")
  void shouldReturnBadRequest_whenUserHeaderMissing() throws Exception {
    mockMvc
        .perform(post("/api/ingest").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(ingestionService, never()).ingest(any(), any(), any());
  }

  @Test
  @DisplayName("Should return 400 when a chunk has no text")
  void shouldReturnBadRequest_whenChunkTextBlank() throws Exception {
    mockMvc
        .perform(
            post("/api/ingest")
                .header(IngestionController.USER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"chunks\":[{\"text\":\" \",\"metadata\":{\"sourceId\":\"a.txt\"}}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should return 400 for an unknown content kind")
  void shouldReturnBadRequest_whenKindUnknown() throws Exception {
    mockMvc
        .perform(
            post("/api/ingest")
                .header(IngestionController.USER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"chunks\":[{\"text\":\"x\",\"metadata\":"
                        + "{\"sourceId\":\"a.txt\",\"kind\":\"audio\"}}]}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should return 429 with quota details when the quota is exhausted")
  void shouldReturnTooManyRequests_whenQuotaExceeded() throws Exception {
    when(ingestionService.ingest(eq("alice"), isNull(), anyList()))
        .thenThrow(new QuotaExceededException("alice", 3, 3, RESET));

    mockMvc
        .perform(
            post("/api/ingest")
                .header(IngestionController.USER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("QUOTA_001"))
        .andExpect(jsonPath("$.attributes.currentCount").value(3))
        .andExpect(jsonPath("$.attributes.remaining").value(0));
  }

  @Test
  @DisplayName("Should return 503 when the embedding model is unavailable")
  void shouldReturnServiceUnavailable_whenEmbeddingFails() throws Exception {
    when(ingestionService.ingest(eq("alice"), isNull(), anyList()))
        .thenThrow(new EmbeddingUnavailableException("timed out", null, true));

    mockMvc
        .perform(
            post("/api/ingest")
                .header(IngestionController.USER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("EMBEDDING_002"));
  }
}
