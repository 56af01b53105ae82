package com.flamingo.ai.contextlab.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline and search. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private Code code = new Code();
  private Excel excel = new Excel();
  private StructuredData structuredData = new StructuredData();
  private AutoTagging autoTagging = new AutoTagging();
  private Search search = new Search();
  private Directory directory = new Directory();

  @Getter
  @Setter
  public static class Code {
    private boolean enabled = true;
    private int maxLinesPerChunk = 100;
    private boolean extractFunctions = true;
    private boolean extractClasses = true;
    private boolean extractImports = true;
  }

  @Getter
  @Setter
  public static class Excel {
    private boolean enabled = true;
    private int maxRowsPerChunk = 100;
    private boolean extractFormulas = true;
    private boolean extractComments = true;
    private boolean detectTables = true;
  }

  @Getter
  @Setter
  public static class StructuredData {
    private boolean enabled = true;

    /** Schema inference stops below this depth and records a sentinel instead. */
    private int maxDepth = 10;

    private int maxArrayItemsPerChunk = 50;
  }

  @Getter
  @Setter
  public static class AutoTagging {
    /** Whether ingestion enriches processed contexts with LLM-generated tags. */
    private boolean enabled = false;

    private int maxContentLength = 4000;

    /** Upper bound for one blocking tagging call, in seconds. */
    private long blockingTimeoutSeconds = 120;
  }

  @Getter
  @Setter
  public static class Search {
    /** Candidate pool size used when computing facets. */
    private int facetCandidates = 100;

    private int maxTagFacets = 20;
  }

  @Getter
  @Setter
  public static class Directory {
    /** Outcomes listed in a directory ingestion report; the counts always cover every file. */
    private int maxReportedResults = 100;
  }
}
