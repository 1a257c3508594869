package com.hubspot.relay.requests;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up a template and substitutes its variables.
 */
public interface TemplateResolver {
  /**
   * @return the rendered template, or empty if no active template has this key
   */
  Optional<RenderedTemplate> resolve(String templateKey, Map<String, String> variables);
}
