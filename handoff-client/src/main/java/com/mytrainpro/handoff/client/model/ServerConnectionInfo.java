package com.mytrainpro.handoff.client.model;

import java.net.URI;

/**
 * Network connection details for the handoff server.
 *
 * @param baseUri the server's base URI (e.g. https://api.mytrainpro.com/). Endpoint paths such as
 *                {@code auth/pending/lookup} are resolved against it.
 */
public record ServerConnectionInfo(URI baseUri) {

  /**
   * Resolves an endpoint path against the base URI.
   *
   * @param path relative endpoint path
   * @return the endpoint URI
   */
  public URI resolve(String path) {
    String base = baseUri.toString();
    return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
  }
}
