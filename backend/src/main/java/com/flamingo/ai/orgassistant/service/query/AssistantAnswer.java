package com.flamingo.ai.orgassistant.service.query;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Answer to a role-specific question, with its evidence and guidance. */
@Value
@Builder
public class AssistantAnswer {
  String answer;
  @Singular List<SourceAttribution> sources;
  double confidence;
  Duration processingTime;
  @Singular List<String> roleNotes;
  @Singular List<String> suggestedActions;
}
