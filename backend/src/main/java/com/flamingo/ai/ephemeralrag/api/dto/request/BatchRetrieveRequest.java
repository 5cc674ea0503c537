package com.flamingo.ai.ephemeralrag.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for several independent queries. Items must be present but are not cascaded into, so
 * that one bad query is reported in its own slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRetrieveRequest {

  @NotEmpty(message = "At least one query is required")
  private List<@NotNull(message = "Batch queries must not be null") RetrieveRequest> queries;
}
