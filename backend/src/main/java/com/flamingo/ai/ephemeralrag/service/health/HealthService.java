package com.flamingo.ai.ephemeralrag.service.health;

import com.flamingo.ai.ephemeralrag.api.dto.response.SystemStats;

/** Service interface for health checks and store statistics. */
public interface HealthService {

  /**
   * Gets store-wide statistics: live sessions, stored chunks and embedding settings.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
