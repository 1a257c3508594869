package com.hubspot.relay.messages;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

/**
 * The output of {@link MessageComposer}: the wire form of a message and the Message-ID it carries.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractComposedMessage {
  public abstract String getMessageId();

  public abstract MessageContent getContent();
}
