package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.ephemeralrag.service.retrieval.BatchItemResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a batch of queries, one slot per query in request order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRetrievalResponse {

  private int succeeded;
  private int failed;
  private List<Item> results;

  /** One slot of the batch: a result or an error. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class Item {
    private int position;
    private RetrievalResponse result;
    private String errorCode;
    private String errorMessage;
  }

  public static BatchRetrievalResponse fromResults(List<BatchItemResult> items) {
    List<Item> slots =
        items.stream()
            .map(
                item ->
                    Item.builder()
                        .position(item.position())
                        .result(
                            item.succeeded() ? RetrievalResponse.fromResult(item.result()) : null)
                        .errorCode(item.errorCode())
                        .errorMessage(item.errorMessage())
                        .build())
            .toList();
    int succeeded = (int) items.stream().filter(BatchItemResult::succeeded).count();
    return BatchRetrievalResponse.builder()
        .succeeded(succeeded)
        .failed(items.size() - succeeded)
        .results(slots)
        .build();
  }
}
