/**
 * This package contains classes to open SMTP sessions and drive them through a delivery.
 *
 * <p>To connect to a relay:
 *
 * <ol><li>Create a {@link com.hubspot.relay.client.SmtpSessionFactoryConfig} to define application-wide settings
 *
 * <li>Pass this to the {@link com.hubspot.relay.client.SmtpSessionFactory} constructor to create a factory
 *
 * <li>Create a {@link com.hubspot.relay.client.SmtpSessionConfig} with the address of the relay and,
 * if the port does not imply it, the {@link com.hubspot.relay.client.TlsMode}
 *
 * <li>Call {@link com.hubspot.relay.client.ConnectionNegotiator#negotiate(com.hubspot.relay.client.SmtpSessionConfig)},
 * which checks the greeting, sends EHLO and performs STARTTLS when required
 * </ol>
 *
 * <p>Once the session is negotiated:
 *
 * <ol><li>Log in with {@link com.hubspot.relay.client.Authenticator#authenticate(com.hubspot.relay.client.SmtpSession, java.lang.String, java.lang.String)}
 *
 * <li>Send a message by calling {@link com.hubspot.relay.client.SmtpSession#send(java.lang.String, java.lang.String, com.hubspot.relay.messages.MessageContent)}
 *
 * <li>Call {@link com.hubspot.relay.client.SmtpSession#quitAndClose()}
 * </ol>
 *
 * <p>Most callers should use {@link com.hubspot.relay.delivery.DeliveryOrchestrator}, which does all
 * of this with retries.
 */
package com.hubspot.relay.client;
