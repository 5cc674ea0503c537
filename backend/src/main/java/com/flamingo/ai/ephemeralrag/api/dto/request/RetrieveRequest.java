package com.flamingo.ai.ephemeralrag.api.dto.request;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.service.retrieval.RetrievalQuery;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a similarity query against one session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrieveRequest {

  @NotBlank(message = "Session id is required")
  private String sessionId;

  @NotBlank(message = "Query is required")
  private String query;

  /** Number of results; the configured default when absent. */
  private Integer k;

  private ContentKind kind;

  private boolean includeVectors;

  public RetrievalQuery toQuery() {
    return new RetrievalQuery(sessionId, query, k, kind, includeVectors);
  }
}
