package com.hubspot.relay.requests;

/**
 * Unchecked exception thrown in strict template mode when a requested template does not exist.
 *
 */
public class TemplateNotFoundException extends RuntimeException {
  private final String templateKey;

  public TemplateNotFoundException(String templateKey) {
    super("Template " + templateKey + " not found");
    this.templateKey = templateKey;
  }

  public String getTemplateKey() {
    return templateKey;
  }
}
