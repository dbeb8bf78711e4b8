package com.flamingo.ai.orgassistant.service.retrieval;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores how well a chunk suits a role: role keywords present in the text, a matching role tag
 * and a preferred content type each add points, and the sum is divided by the word count so long
 * chunks do not win by size alone.
 */
@Component
@RequiredArgsConstructor
public class RoleRelevanceScorer {

  private final RagConfig ragConfig;

  public double score(String content, Map<String, Object> metadata, UserRole role) {
    RagConfig.Lexicon lexicon = ragConfig.getLexicon();
    RagConfig.Retrieval weights = ragConfig.getRetrieval();
    String text = content == null ? "" : content.toLowerCase(Locale.ROOT);

    double points = 0;
    for (String keyword : lexicon.getRoleKeywords().getOrDefault(role.getValue(), List.of())) {
      if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
        points += weights.getKeywordWeight();
      }
    }
    if (hasRoleTag(metadata.get(ChunkFields.ROLE_TAGS), role)) {
      points += weights.getRoleTagWeight();
    }
    Object contentType = metadata.get(ChunkFields.CONTENT_TYPE);
    if (contentType != null
        && lexicon
            .getRoleContentTypes()
            .getOrDefault(role.getValue(), List.of())
            .contains(contentType.toString())) {
      points += weights.getContentTypeWeight();
    }
    return points / Math.max(wordCount(text), 1);
  }

  private static boolean hasRoleTag(Object roleTags, UserRole role) {
    if (roleTags instanceof Collection<?> tags) {
      return tags.stream().anyMatch(tag -> role.getValue().equalsIgnoreCase(String.valueOf(tag)));
    }
    return roleTags != null && roleTags.toString().contains(role.getValue());
  }

  private static int wordCount(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
