package com.flamingo.ai.orgassistant.service.query;

import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A question asked on behalf of a role. */
@Value
@Builder
public class QueryContext {
  String query;
  UserRole role;

  /** Extra situational context passed to the answer generator, may be null. */
  String additionalContext;

  /** Keyword filters applied to retrieval. */
  @Singular Map<String, Object> filters;
}
