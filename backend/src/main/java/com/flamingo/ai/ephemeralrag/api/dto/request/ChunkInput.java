package com.flamingo.ai.ephemeralrag.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one passage to ingest. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkInput {

  @NotBlank(message = "Chunk text is required")
  private String text;

  /** Position within the source document; assigned from request order when absent. */
  @PositiveOrZero(message = "Sequence must not be negative")
  private Integer sequence;

  @Valid
  @NotNull(message = "Chunk metadata is required")
  private ChunkMetadataInput metadata;
}
