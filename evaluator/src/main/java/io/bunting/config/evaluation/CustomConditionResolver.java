package io.bunting.config.evaluation;

import io.bunting.config.Condition;
import java.util.Optional;

/**
 * Evaluates {@code custom_attribute} conditions, whose meaning belongs to the embedding
 * application. Returning empty means the condition could not be resolved; an unresolved condition
 * never matches.
 */
@FunctionalInterface
public interface CustomConditionResolver {

  CustomConditionResolver NONE = (condition, context) -> Optional.empty();

  Optional<Boolean> resolve(Condition condition, EvaluationContext context);
}
