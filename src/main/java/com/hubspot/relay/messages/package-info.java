/**
 * This package contains classes that represent the content of an email.
 *
 * <p>Build an {@link com.hubspot.relay.messages.EmailMessage} and pass it to
 * {@link com.hubspot.relay.messages.MessageComposer#compose(com.hubspot.relay.messages.EmailMessage, java.lang.String)}
 * to get the MIME content that {@link com.hubspot.relay.client.SmtpSession#send(java.lang.String, java.lang.String, com.hubspot.relay.messages.MessageContent)}
 * transmits.
 *
 */
package com.hubspot.relay.messages;
