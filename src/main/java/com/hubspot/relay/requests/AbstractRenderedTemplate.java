package com.hubspot.relay.requests;

import java.util.Optional;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

/**
 * A template with its placeholders filled in.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractRenderedTemplate {
  public abstract String getSubject();

  public abstract String getText();

  public abstract Optional<String> getHtml();
}
