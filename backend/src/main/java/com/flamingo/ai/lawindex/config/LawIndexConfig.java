package com.flamingo.ai.lawindex.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the statute indexing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "law-index")
@Getter
@Setter
public class LawIndexConfig {

  private Source source = new Source();
  private Rendering rendering = new Rendering();
  private Indexing indexing = new Indexing();

  /** Tabular dataset the statutes are read from. */
  @Getter
  @Setter
  public static class Source {
    private String csvPath = "luat.csv";
    private String subjectColumn = "subject";
    private String textColumn = "text";

    /** A row is kept only if its subject contains this marker ("latest"). */
    private String includeMarker = "mới nhất";

    /** A row is dropped if its subject contains this marker ("amended"). */
    private String excludeMarker = "sửa đổi";
  }

  @Getter
  @Setter
  public static class Rendering {
    /** Embed the clause/article citation path in every clause and point line. */
    private boolean expandCitation = false;
  }

  @Getter
  @Setter
  public static class Indexing {
    /** Run the full load-parse-index pipeline once when the application starts. */
    private boolean runOnStartup = false;

    private int batchSize = 64;

    /** File the in-memory embedding store is serialized to after indexing. */
    private String storePath = "data/law-embeddings.json";

    private int parallelism = 4;
  }
}
