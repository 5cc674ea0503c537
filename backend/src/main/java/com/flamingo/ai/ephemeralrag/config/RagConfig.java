package com.flamingo.ai.ephemeralrag.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ephemeral RAG store. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Embedding embedding = new Embedding();
  private Session session = new Session();
  private Quota quota = new Quota();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();
  private Export export = new Export();

  @Getter
  @Setter
  public static class Embedding {
    /** Dimension every stored and query vector must have. */
    private int dimension = 384;

    private String modelName = "text-embedding-3-small";

    /** Upper bound on a single embedding call, after which it is cancelled. */
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Session {
    /** Idle time after which a session is reclaimed. */
    private Duration ttl = Duration.ofHours(1);

    private Duration sweepInterval = Duration.ofMinutes(5);
    private int maxChunks = 5000;
  }

  @Getter
  @Setter
  public static class Quota {
    private int maxChunksPerWindow = 2000;
    private Duration window = Duration.ofHours(24);
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultK = 5;
    private int maxK = 50;
    private int maxQueryLength = 1000;
    private int maxBatchQueries = 10;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int maxBatchSize = 1000;
    private int maxTextLength = 20000;
  }

  @Getter
  @Setter
  public static class Export {
    private int maxPageSize = 100;
  }
}
