package com.flamingo.ai.orgassistant.service.query;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.service.retrieval.RankedResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Role notes and follow-up suggestions derived from the evidence behind an answer. */
@Component
@RequiredArgsConstructor
public class RoleGuidance {

  private final RagConfig ragConfig;

  public List<String> notes(UserRole role, List<RankedResult> results) {
    Set<String> contentTypes =
        results.stream()
            .map(r -> r.metadataString(ChunkFields.CONTENT_TYPE))
            .collect(Collectors.toSet());
    List<String> notes = new ArrayList<>();
    switch (role) {
      case DEVELOPER -> {
        if (contentTypes.contains("code_snippet")) {
          notes.add("Code examples available in sources");
        }
        if (contentTypes.contains("api_documentation")) {
          notes.add("API documentation referenced");
        }
      }
      case SUPPORT -> {
        if (contentTypes.contains("troubleshooting")) {
          notes.add("Troubleshooting guides available");
        }
        if (results.stream()
            .anyMatch(r -> r.content().toLowerCase(Locale.ROOT).contains("error"))) {
          notes.add("Error cases and solutions documented");
        }
      }
      case MANAGER -> {
        long sources =
            results.stream().map(r -> r.metadataString(ChunkFields.SOURCE)).distinct().count();
        notes.add("Information gathered from " + sources + " different sources");
      }
      case GENERAL -> {
        // no role-specific notes
      }
    }
    return notes;
  }

  public List<String> suggestedActions(UserRole role) {
    return List.copyOf(
        ragConfig.getGuidance().getSuggestedActions().getOrDefault(role.getValue(), List.of()));
  }

  public List<String> emptyResultActions() {
    return List.copyOf(ragConfig.getGuidance().getEmptyResultActions());
  }
}
