package com.hubspot.relay.requests;

import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value.Check;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A request to email one recipient, either from a template or with an explicit subject.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractEmailRequest {
  public abstract String getTo();

  /**
   * Overrides the template's subject when present and not blank.
   */
  public abstract Optional<String> getSubject();

  public abstract Optional<String> getTemplateKey();

  /**
   * Values for the template's placeholders.
   */
  public abstract Map<String, String> getVariables();

  /**
   * Gets the trimmed subject override, if one was given.
   */
  public Optional<String> getExplicitSubject() {
    return getSubject().map(String::trim).filter(subject -> !subject.isEmpty());
  }

  @Check
  protected void check() {
    Preconditions.checkState(!Strings.isNullOrEmpty(getTo().trim()), "to must not be empty");
  }
}
