/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Outbound proxy configuration read from the conventional environment variables. An HTTPS proxy
 * is preferred over an HTTP one when both are set, and hosts matching {@code NO_PROXY} bypass it.
 *
 * <p>Lower-case variable names take precedence over upper-case ones, as in curl.
 */
public final class ProxySettings {
  static final Logger logger = Logger.getLogger(ProxySettings.class.getName());

  public static final ProxySettings NONE = new ProxySettings(null, Collections.<String>emptyList());

  /** Reads the proxy configuration from {@link System#getenv()}. */
  public static ProxySettings fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static ProxySettings fromEnvironment(Map<String, String> environment) {
    if (environment == null) throw new NullPointerException("environment == null");
    String proxy = variable(environment, "https_proxy");
    if (proxy == null) proxy = variable(environment, "http_proxy");
    if (proxy == null) return NONE;

    URI proxyUri;
    try {
      proxyUri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
    } catch (IllegalArgumentException e) {
      logger.warning("ignoring invalid proxy url " + proxy + ": " + e.getMessage());
      return NONE;
    }
    if (proxyUri.getHost() == null) {
      logger.warning("ignoring proxy url without a host: " + proxy);
      return NONE;
    }

    List<String> noProxy = new ArrayList<String>();
    String noProxyValue = variable(environment, "no_proxy");
    if (noProxyValue != null) {
      for (String entry : noProxyValue.split(",")) {
        entry = entry.trim().toLowerCase(Locale.ROOT);
        int colon = entry.lastIndexOf(':');
        if (colon > 0 && entry.indexOf(']') < colon) entry = entry.substring(0, colon);
        if (entry.startsWith(".")) entry = entry.substring(1);
        if (!entry.isEmpty()) noProxy.add(entry);
      }
    }
    return new ProxySettings(proxyUri, Collections.unmodifiableList(noProxy));
  }

  static String variable(Map<String, String> environment, String lowerCaseName) {
    String value = environment.get(lowerCaseName);
    if (value == null || value.trim().isEmpty()) {
      value = environment.get(lowerCaseName.toUpperCase(Locale.ROOT));
    }
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  final URI proxyUri; // null when no proxy is configured
  final List<String> noProxy;

  ProxySettings(URI proxyUri, List<String> noProxy) {
    this.proxyUri = proxyUri;
    this.noProxy = noProxy;
  }

  /** The proxy URL in use, or null if requests go direct. */
  public URI proxyUri() {
    return proxyUri;
  }

  /** Returns the proxy to use for connections to the host, or {@link Proxy#NO_PROXY}. */
  public Proxy proxyFor(String host) {
    if (proxyUri == null || bypass(host)) return Proxy.NO_PROXY;
    int port = proxyUri.getPort();
    if (port == -1) port = "https".equalsIgnoreCase(proxyUri.getScheme()) ? 443 : 80;
    return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(proxyUri.getHost(), port));
  }

  boolean bypass(String host) {
    if (host == null) return false;
    host = host.toLowerCase(Locale.ROOT);
    for (String entry : noProxy) {
      if (entry.equals("*") || host.equals(entry) || host.endsWith("." + entry)) return true;
    }
    return false;
  }

  @Override public String toString() {
    return proxyUri == null ? "ProxySettings{NONE}" : "ProxySettings{" + proxyUri.getHost() + "}";
  }
}
