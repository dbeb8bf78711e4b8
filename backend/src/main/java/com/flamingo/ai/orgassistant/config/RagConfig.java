package com.flamingo.ai.orgassistant.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Store store = new Store();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();
  private Lexicon lexicon = new Lexicon();
  private Guidance guidance = new Guidance();

  @Getter
  @Setter
  public static class Chunking {
    /** Target chunk size in characters. */
    private int size = 1000;

    /** Characters shared by adjacent chunks. */
    private int overlap = 200;

    /** Cleaned content shorter than this is skipped. */
    private int minContentLength = 50;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding backend: "local" (in-process model) or "remote" (managed API). */
    private String provider = "local";

    private Local local = new Local();
    private Remote remote = new Remote();

    @Getter
    @Setter
    public static class Local {
      /** Declared vector dimension of the in-process model. */
      private int dimensions = 384;
    }

    @Getter
    @Setter
    public static class Remote {
      /** Declared vector dimension of the remote model; zero vectors use this length. */
      private int dimensions = 1536;

      /** Upper bound of outstanding remote calls. */
      private int maxConcurrency = 10;

      /** Texts are truncated to this many characters before being sent. */
      private int maxChars = 8000;
    }
  }

  @Getter
  @Setter
  public static class Store {
    /** Chunk store backend: "embedded" (local persistent files) or "elasticsearch". */
    private String backend = "embedded";

    private Embedded embedded = new Embedded();
    private Elasticsearch elasticsearch = new Elasticsearch();

    @Getter
    @Setter
    public static class Embedded {
      /** Directory holding one JSON file per partition. */
      private String path = "data/vector-store";
    }

    @Getter
    @Setter
    public static class Elasticsearch {
      /** Index name prefix; partitions are stored in {@code <prefix>-<role>}. */
      private String indexPrefix = "org-assistant";

      /** kNN candidates considered per shard, as a multiple of the requested limit. */
      private int numCandidatesMultiplier = 10;

      /** HNSW graph: maximum connections per node. */
      private int hnswM = 16;

      /** HNSW graph: candidate list size during construction. */
      private int hnswEfConstruction = 512;

      private int numberOfShards = 2;
      private int numberOfReplicas = 1;
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Candidates fetched from the store before re-ranking. */
    private int overFetch = 15;

    /** Results kept after re-ranking. */
    private int topK = 8;

    /** Result count at which the evidence factor of the confidence reaches 1.0. */
    private int fullEvidenceCount = 5;

    /** Documents updated within this many days count as recent. */
    private int recencyWindowDays = 30;

    /** Confidence bonus when every result is recent. */
    private double recencyBonus = 0.1;

    /** Points for a role keyword found in the content. */
    private double keywordWeight = 1.0;

    /** Points when the chunk is tagged with the querying role. */
    private double roleTagWeight = 3.0;

    /** Points when the chunk's content type suits the querying role. */
    private double contentTypeWeight = 2.0;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Documents processed concurrently within one batch. */
    private int parallelism = 4;
  }

  /**
   * Declarative lexicons used for content classification and role relevance. Keys of the role maps
   * are role wire values (developer, support, manager, general).
   */
  @Getter
  @Setter
  public static class Lexicon {

    private Map<String, List<String>> roleKeywords = defaultRoleKeywords();

    private Map<String, List<String>> roleContentTypes = defaultRoleContentTypes();

    /** Ordered classification rules; the first matching rule names the content type. */
    private List<ContentTypeRule> contentTypes = defaultContentTypes();

    private List<String> technicalKeywords =
        new ArrayList<>(
            List.of(
                "api", "sdk", "auth", "authentication", "authorization", "config",
                "configuration", "deploy", "deployment", "build", "test", "debug", "error",
                "exception", "database", "cache", "queue", "service", "microservice",
                "container", "docker", "kubernetes", "aws", "azure", "gcp", "cloud", "server",
                "client", "frontend", "backend", "fullstack", "rest", "graphql", "websocket",
                "security", "ssl", "tls", "oauth", "jwt", "token", "session", "performance",
                "optimization", "monitoring", "logging", "metrics"));

    private List<String> complexityTerms =
        new ArrayList<>(
            List.of("api", "configuration", "deployment", "architecture", "algorithm"));

    private List<String> codeIndicators =
        new ArrayList<>(
            List.of("```", "    ", "\t", "function(", "def ", "class ", "import ", "from "));

    private static Map<String, List<String>> defaultRoleKeywords() {
      Map<String, List<String>> map = new LinkedHashMap<>();
      map.put(
          "developer",
          new ArrayList<>(
              List.of(
                  "code",
                  "api",
                  "implementation",
                  "technical",
                  "architecture",
                  "deployment",
                  "configuration")));
      map.put(
          "support",
          new ArrayList<>(
              List.of(
                  "troubleshooting",
                  "error",
                  "issue",
                  "problem",
                  "solution",
                  "support",
                  "diagnostic")));
      map.put(
          "manager",
          new ArrayList<>(
              List.of(
                  "process", "team", "planning", "strategy", "decision", "management", "roadmap")));
      return map;
    }

    private static Map<String, List<String>> defaultRoleContentTypes() {
      Map<String, List<String>> map = new LinkedHashMap<>();
      map.put(
          "developer",
          new ArrayList<>(List.of("code_snippet", "api_documentation", "configuration")));
      map.put("support", new ArrayList<>(List.of("troubleshooting", "setup_instructions")));
      return map;
    }

    private static List<ContentTypeRule> defaultContentTypes() {
      List<ContentTypeRule> rules = new ArrayList<>();
      rules.add(
          new ContentTypeRule(
              "code_snippet",
              true,
              List.of("```", "function", "class ", "def ", "import ", "const ", "var ")));
      rules.add(
          new ContentTypeRule(
              "configuration", false, List.of("config", "settings", "environment", "env")));
      rules.add(
          new ContentTypeRule(
              "api_documentation",
              false,
              List.of("api", "endpoint", "request", "response", "curl")));
      rules.add(
          new ContentTypeRule(
              "troubleshooting",
              false,
              List.of("error", "troubleshoot", "problem", "solution", "fix")));
      rules.add(
          new ContentTypeRule(
              "setup_instructions",
              false,
              List.of("install", "setup", "deploy", "build", "run")));
      return rules;
    }
  }

  /** A content classification rule: any signal present selects {@code name}. */
  @Getter
  @Setter
  @NoArgsConstructor
  public static class ContentTypeRule {
    private String name;

    /** When false, signals are matched against the lower-cased content. */
    private boolean caseSensitive;

    private List<String> signals = new ArrayList<>();

    public ContentTypeRule(String name, boolean caseSensitive, List<String> signals) {
      this.name = name;
      this.caseSensitive = caseSensitive;
      this.signals = new ArrayList<>(signals);
    }
  }

  /** Role-specific follow-up suggestions attached to answers. */
  @Getter
  @Setter
  public static class Guidance {
    private Map<String, List<String>> suggestedActions = defaultSuggestedActions();

    private List<String> emptyResultActions =
        new ArrayList<>(
            List.of(
                "Try rephrasing your question",
                "Check if documentation exists for this topic"));

    private static Map<String, List<String>> defaultSuggestedActions() {
      Map<String, List<String>> map = new LinkedHashMap<>();
      map.put(
          "developer",
          new ArrayList<>(
              List.of(
                  "Review code examples in referenced files",
                  "Check for related test files or documentation",
                  "Consider implementation best practices")));
      map.put(
          "support",
          new ArrayList<>(
              List.of(
                  "Follow diagnostic steps systematically",
                  "Document issue details for tracking",
                  "Escalate if resolution steps don't work")));
      map.put(
          "manager",
          new ArrayList<>(
              List.of(
                  "Review team processes and documentation",
                  "Consider resource allocation for improvements",
                  "Plan knowledge sharing sessions")));
      return map;
    }
  }
}
