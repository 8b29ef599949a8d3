/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.urlconnection;

import apmagent.transport.BaseHttpSender;
import apmagent.transport.ProxySettings;
import apmagent.transport.ServerCertificate;
import apmagent.transport.internal.InsecureTls;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Map;
import javax.net.ssl.HttpsURLConnection;
import okio.BufferedSource;
import okio.Okio;

/**
 * Posts batches to the APM Server with {@link HttpURLConnection}, one blocking request at a time.
 *
 * <p>This sender is thread-safe.
 */
public final class URLConnectionSender extends BaseHttpSender<URL> {

  /** Creates a sender that posts to the intake endpoint, usually "http://host:8200/intake/v2/events". */
  public static URLConnectionSender create(String endpoint) {
    return newBuilder().endpoint(endpoint).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String endpoint;
    int connectTimeout = 10 * 1000;
    boolean verifyServerCert = true;
    ProxySettings proxySettings;
    ServerCertificate serverCert;

    Builder(URLConnectionSender sender) {
      this.endpoint = sender.endpoint.toString();
      this.connectTimeout = sender.connectTimeout;
      this.verifyServerCert = sender.verifyServerCert;
      this.proxySettings = sender.proxySettings;
      this.serverCert = sender.serverCert;
    }

    /** No default. The APM Server intake URL, usually "http://host:8200/intake/v2/events" */
    public Builder endpoint(String endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      this.endpoint = endpoint;
      return this;
    }

    public Builder endpoint(URL endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      this.endpoint = endpoint.toString();
      return this;
    }

    /** Default 10 * 1000 milliseconds. 0 implies no timeout. */
    public Builder connectTimeout(int connectTimeout) {
      if (connectTimeout < 0) throw new IllegalArgumentException("connectTimeout < 0");
      this.connectTimeout = connectTimeout;
      return this;
    }

    /** Default true. When false, https endpoints are not checked for a trusted certificate. */
    public Builder verifyServerCert(boolean verifyServerCert) {
      this.verifyServerCert = verifyServerCert;
      return this;
    }

    /**
     * No default. When set, https endpoints must present exactly this certificate, and {@link
     * #verifyServerCert(boolean)} is ignored.
     */
    public Builder serverCert(ServerCertificate serverCert) {
      this.serverCert = serverCert;
      return this;
    }

    /** Defaults to {@link ProxySettings#fromEnvironment()}, read when the sender is built. */
    public Builder proxySettings(ProxySettings proxySettings) {
      if (proxySettings == null) throw new NullPointerException("proxySettings == null");
      this.proxySettings = proxySettings;
      return this;
    }

    public URLConnectionSender build() {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      return new URLConnectionSender(this);
    }

    Builder() {
    }
  }

  final int connectTimeout;
  final boolean verifyServerCert;
  final ProxySettings proxySettings;
  final ServerCertificate serverCert; // nullable

  URLConnectionSender(Builder builder) {
    super(builder.endpoint);
    this.connectTimeout = builder.connectTimeout;
    this.verifyServerCert = builder.verifyServerCert;
    this.serverCert = builder.serverCert;
    this.proxySettings =
      builder.proxySettings != null ? builder.proxySettings : ProxySettings.fromEnvironment();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override protected URL newEndpoint(String endpoint) {
    try {
      return new URL(endpoint);
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException(e.getMessage());
    }
  }

  @Override protected Response post(URL endpoint, byte[] body, Map<String, String> headers,
    int timeoutMillis) throws IOException {
    // intentionally not closing the connection, to use keep-alives
    HttpURLConnection connection =
      (HttpURLConnection) endpoint.openConnection(proxySettings.proxyFor(endpoint.getHost()));
    if (connection instanceof HttpsURLConnection) {
      HttpsURLConnection https = (HttpsURLConnection) connection;
      if (serverCert != null) {
        https.setSSLSocketFactory(serverCert.socketFactory());
        https.setHostnameVerifier(serverCert.hostnameVerifier());
      } else if (!verifyServerCert) {
        https.setSSLSocketFactory(InsecureTls.socketFactory());
        https.setHostnameVerifier(InsecureTls.hostnameVerifier());
      }
    }
    connection.setConnectTimeout(connectTimeout);
    connection.setReadTimeout(timeoutMillis);
    connection.setRequestMethod("POST");
    for (Map.Entry<String, String> header : headers.entrySet()) {
      connection.setRequestProperty(header.getKey(), header.getValue());
    }
    connection.setDoOutput(true);
    connection.setFixedLengthStreamingMode(body.length);
    try (OutputStream out = connection.getOutputStream()) {
      out.write(body);
    }

    int status = connection.getResponseCode();
    String location = connection.getHeaderField("Location");
    InputStream in = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
    return Response.create(status, location, readUtf8(in));
  }

  /** Reads the whole stream, so that the connection can be reused. */
  static String readUtf8(InputStream in) throws IOException {
    if (in == null) return ""; // possible when the connection was dropped
    try (BufferedSource source = Okio.buffer(Okio.source(in))) {
      return source.readUtf8();
    }
  }

  @Override public String toString() {
    return "URLConnectionSender{" + endpoint + "}";
  }
}
