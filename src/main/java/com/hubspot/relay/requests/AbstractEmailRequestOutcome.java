package com.hubspot.relay.requests;

import java.util.List;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.hubspot.relay.delivery.DeliveryResult;

/**
 * A delivered request, with the choices made on the caller's behalf.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractEmailRequestOutcome {
  public abstract DeliveryResult getDeliveryResult();

  public abstract String getSubject();

  /**
   * False when the requested template was missing and the branded fallback was sent instead.
   */
  public abstract boolean isTemplateFound();

  public abstract boolean isExplicitSubjectUsed();

  /**
   * Problems that did not stop the delivery, e.g. a sender domain that differs from the login's.
   */
  public abstract List<String> getWarnings();
}
