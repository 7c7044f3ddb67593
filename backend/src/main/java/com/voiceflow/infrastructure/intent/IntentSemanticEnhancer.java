package com.voiceflow.infrastructure.intent;

import com.voiceflow.domain.workflow.model.IntentType;
import com.voiceflow.domain.workflow.model.SemanticIntent;

import java.util.Optional;

/**
 * Optional semantic refinement of a rule-based intent classification.
 * Implementations report failure as an empty result instead of throwing.
 */
public interface IntentSemanticEnhancer {

    Optional<SemanticIntent> enhance(String processedText, IntentType ruleIntent);
}
