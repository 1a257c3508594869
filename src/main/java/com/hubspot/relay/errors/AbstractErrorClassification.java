package com.hubspot.relay.errors;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Parameter;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

/**
 * The outcome of classifying a failure.
 */
@Immutable
@Style(typeImmutable = "*", visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractErrorClassification {
  @Parameter
  public abstract ErrorCategory getCategory();

  @Parameter
  public abstract boolean isTransient();

  @Parameter
  public abstract String getSuggestion();

  public static ErrorClassification forCategory(ErrorCategory category) {
    return ErrorClassification.of(category, category.isTransient(), category.getSuggestion());
  }
}
