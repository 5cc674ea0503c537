package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.flamingo.ai.ephemeralrag.service.export.ChunkPage;
import com.flamingo.ai.ephemeralrag.service.export.ChunkView;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a page of stored chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkPageResponse {

  private String sessionId;
  private int offset;
  private int limit;
  private int total;
  private boolean hasMore;
  private List<ChunkView> chunks;

  public static ChunkPageResponse fromPage(ChunkPage page) {
    return ChunkPageResponse.builder()
        .sessionId(page.sessionId())
        .offset(page.offset())
        .limit(page.limit())
        .total(page.total())
        .hasMore(page.hasMore())
        .chunks(page.chunks())
        .build();
  }
}
