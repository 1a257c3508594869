package com.hubspot.relay.requests;

import com.google.common.html.HtmlEscapers;

/**
 * The generic notification sent when no template applies, branded with the business name.
 */
final class BrandedFallbackTemplate {
  private BrandedFallbackTemplate() {
    throw new AssertionError("Cannot create static utility class");
  }

  static RenderedTemplate render(String businessName) {
    String escapedName = HtmlEscapers.htmlEscaper().escape(businessName);

    String html = "<html>\n"
        + "  <body style=\"font-family: Arial, sans-serif; color: #333; line-height: 1.6;\">\n"
        + "    <div style=\"max-width: 600px; margin: 0 auto; padding: 20px;\">\n"
        + "      <h2 style=\"color: #f59e0b; margin-bottom: 20px;\">" + escapedName + "</h2>\n"
        + "      <p>Thank you for your business with us.</p>\n"
        + "      <p>This is an automated notification regarding your recent activity.</p>\n"
        + "      <hr style=\"border: none; border-top: 1px solid #eee; margin: 20px 0;\">\n"
        + "      <p style=\"font-size: 12px; color: #666;\">\n"
        + "        This email was sent from our automated system. Please do not reply directly.\n"
        + "      </p>\n"
        + "    </div>\n"
        + "  </body>\n"
        + "</html>\n";

    String text = businessName + "\n\n"
        + "Thank you for your business with us.\n\n"
        + "This is an automated notification regarding your recent activity.\n\n"
        + "This email was sent from our automated system.";

    return RenderedTemplate.builder()
        .subject(businessName + " - Important Notification")
        .text(text)
        .html(html)
        .build();
  }
}
