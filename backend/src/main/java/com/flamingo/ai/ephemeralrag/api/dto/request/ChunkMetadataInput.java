package com.flamingo.ai.ephemeralrag.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for the metadata of one passage. Accepts the upload pipeline's older field names. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkMetadataInput {

  @NotBlank(message = "Source id is required")
  @Size(max = 255, message = "Source id must be at most 255 characters")
  @JsonAlias("filename")
  private String sourceId;

  @PositiveOrZero(message = "Position must not be negative")
  @JsonAlias("page")
  private Integer position;

  @JsonAlias("type")
  private ContentKind kind;

  public ChunkMetadata toMetadata() {
    return new ChunkMetadata(sourceId, position, kind);
  }
}
