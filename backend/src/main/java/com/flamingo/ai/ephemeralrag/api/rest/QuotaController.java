package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.api.dto.response.QuotaResponse;
import com.flamingo.ai.ephemeralrag.service.quota.QuotaTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for upload quota status. */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

  private final QuotaTracker quotaTracker;

  @GetMapping("/{userId}")
  public ResponseEntity<QuotaResponse> getQuota(@PathVariable String userId) {
    return ResponseEntity.ok(QuotaResponse.fromStatus(quotaTracker.status(userId)));
  }
}
