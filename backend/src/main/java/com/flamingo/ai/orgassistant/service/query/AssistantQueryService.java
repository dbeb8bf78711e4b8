package com.flamingo.ai.orgassistant.service.query;

import com.flamingo.ai.orgassistant.service.retrieval.RetrievalResult;
import com.flamingo.ai.orgassistant.service.retrieval.RoleAwareRetriever;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Answers a question: retrieves evidence for the role, asks the answer generator when there is
 * evidence and attaches sources, confidence and role guidance. Without an {@link AnswerGenerator}
 * bean the service runs retrieval only and returns an empty answer text.
 */
@Service
@Slf4j
public class AssistantQueryService {

  static final String INSUFFICIENT_INFORMATION =
      "I don't have enough information to answer your question. Please provide more specific"
          + " details or check if the relevant documentation is available in the system.";

  private final RoleAwareRetriever retriever;
  private final ObjectProvider<AnswerGenerator> answerGenerator;
  private final RoleGuidance roleGuidance;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public AssistantQueryService(
      RoleAwareRetriever retriever,
      ObjectProvider<AnswerGenerator> answerGenerator,
      RoleGuidance roleGuidance,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.retriever = retriever;
    this.answerGenerator = answerGenerator;
    this.roleGuidance = roleGuidance;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public AssistantAnswer answer(QueryContext context) {
    Instant start = clock.instant();
    try {
      RetrievalResult retrieval =
          retriever.retrieve(context.getQuery(), context.getRole(), context.getFilters());
      if (retrieval.isInsufficient()) {
        meterRegistry.counter("rag.query.insufficient").increment();
        log.info("No evidence found for {} question, skipping generation", context.getRole());
        return AssistantAnswer.builder()
            .answer(INSUFFICIENT_INFORMATION)
            .confidence(0.0)
            .processingTime(elapsedSince(start))
            .roleNote("No relevant documents found")
            .suggestedActions(roleGuidance.emptyResultActions())
            .build();
      }

      AnswerGenerator generator = answerGenerator.getIfAvailable();
      String text = generator == null ? "" : generator.generate(context, retrieval.results());
      meterRegistry.counter("rag.query.answered").increment();
      return AssistantAnswer.builder()
          .answer(text)
          .sources(retrieval.results().stream().map(SourceAttribution::from).toList())
          .confidence(retrieval.confidence())
          .processingTime(elapsedSince(start))
          .roleNotes(roleGuidance.notes(context.getRole(), retrieval.results()))
          .suggestedActions(roleGuidance.suggestedActions(context.getRole()))
          .build();
    } catch (RuntimeException e) {
      log.error("Error processing {} question: {}", context.getRole(), e.getMessage(), e);
      meterRegistry.counter("rag.query.errors").increment();
      return AssistantAnswer.builder()
          .answer(
              "I encountered an error while processing your question: "
                  + e.getMessage()
                  + ". Please try again or rephrase your question.")
          .confidence(0.0)
          .processingTime(elapsedSince(start))
          .roleNote("Error occurred during processing")
          .suggestedActions(
              List.of(
                  "Try rephrasing your question", "Contact system administrator if error persists"))
          .build();
    }
  }

  private Duration elapsedSince(Instant start) {
    return Duration.between(start, clock.instant());
  }
}
