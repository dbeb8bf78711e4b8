package com.flamingo.ai.orgassistant.service.query;

import com.flamingo.ai.orgassistant.service.retrieval.RankedResult;
import java.util.List;

/**
 * Produces the final answer text from ranked evidence. Prompt construction and the model call live
 * behind this interface.
 */
public interface AnswerGenerator {

  String generate(QueryContext context, List<RankedResult> evidence);
}
