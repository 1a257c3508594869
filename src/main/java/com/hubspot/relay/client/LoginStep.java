package com.hubspot.relay.client;

/**
 * The continuation lines a client sends after {@code AUTH LOGIN}, each answering a 334 challenge.
 */
public enum LoginStep {
  USERNAME,
  PASSWORD
}
