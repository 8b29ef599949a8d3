/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.okhttp3;

import apmagent.transport.BaseHttpSender;
import apmagent.transport.ProxySettings;
import apmagent.transport.ServerCertificate;
import apmagent.transport.internal.InsecureTls;
import java.io.IOException;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Posts batches to the APM Server with OkHttp, reusing pooled connections between requests.
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * sender = OkHttpSender.create("http://127.0.0.1:8200/intake/v2/events");
 * }</pre>
 *
 * <p>Here's an example that pins a self-signed APM Server, and adds an interceptor to the client:
 *
 * <pre>{@code
 * sender = OkHttpSender.newBuilder()
 *   .endpoint("https://apm-server:8200/intake/v2/events")
 *   .serverCert(ServerCertificate.fromPemFile(Paths.get("/etc/apm/server.pem")))
 *   .clientBuilder().addInterceptor(loggingInterceptor)
 *   .build();
 * }</pre>
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>The per-request timeout passed to {@link #send} bounds the whole call, including connecting,
 * writing the body and reading the response. This sender is thread-safe.
 */
public final class OkHttpSender extends BaseHttpSender<HttpUrl> {
  static final MediaType NDJSON = MediaType.get("application/x-ndjson");

  /** Creates a sender that posts to the intake endpoint, usually "http://host:8200/intake/v2/events". */
  public static OkHttpSender create(String endpoint) {
    return newBuilder().endpoint(endpoint).build();
  }

  public static Builder newBuilder() {
    return new Builder(new OkHttpClient.Builder());
  }

  public static final class Builder {
    final OkHttpClient.Builder clientBuilder;
    String endpoint;
    boolean verifyServerCert = true;
    ProxySettings proxySettings;
    ServerCertificate serverCert;

    Builder(OkHttpClient.Builder clientBuilder) {
      this.clientBuilder = clientBuilder;
    }

    Builder(OkHttpSender sender) {
      clientBuilder = sender.client.newBuilder();
      endpoint = sender.endpoint.toString();
      verifyServerCert = sender.verifyServerCert;
      proxySettings = sender.proxySettings;
      serverCert = sender.serverCert;
    }

    /** No default. The APM Server intake URL, usually "http://host:8200/intake/v2/events" */
    public Builder endpoint(String endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      this.endpoint = endpoint;
      return this;
    }

    public Builder endpoint(HttpUrl endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      this.endpoint = endpoint.toString();
      return this;
    }

    /** Sets the default connect timeout (in milliseconds) for new connections. Default 10000 */
    public Builder connectTimeout(int connectTimeoutMillis) {
      clientBuilder.connectTimeout(connectTimeoutMillis, MILLISECONDS);
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

    public OkHttpClient.Builder clientBuilder() {
      return clientBuilder;
    }

    public OkHttpSender build() {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      return new OkHttpSender(this);
    }
  }

  final OkHttpClient client;
  final boolean verifyServerCert;
  final ProxySettings proxySettings;
  final ServerCertificate serverCert; // nullable

  OkHttpSender(Builder builder) {
    super(builder.endpoint);
    this.verifyServerCert = builder.verifyServerCert;
    this.serverCert = builder.serverCert;
    this.proxySettings =
      builder.proxySettings != null ? builder.proxySettings : ProxySettings.fromEnvironment();

    // doing the extra "build" here prevents us from leaking our settings to the builder
    OkHttpClient.Builder clientBuilder = builder.clientBuilder.build().newBuilder()
      .proxySelector(new ProxySettingsSelector(proxySettings));
    if (serverCert != null) {
      clientBuilder.sslSocketFactory(serverCert.socketFactory(), serverCert.trustManager())
        .hostnameVerifier(serverCert.hostnameVerifier());
    } else if (!verifyServerCert) {
      clientBuilder.sslSocketFactory(InsecureTls.socketFactory(), InsecureTls.trustManager())
        .hostnameVerifier(InsecureTls.hostnameVerifier());
    }
    this.client = clientBuilder.build();
  }

  /**
   * Creates a builder out of this object. Note: customizations of the {@link
   * Builder#clientBuilder()} are carried over.
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override protected HttpUrl newEndpoint(String endpoint) {
    HttpUrl parsed = HttpUrl.parse(endpoint);
    if (parsed == null) throw new IllegalArgumentException("invalid POST url: " + endpoint);
    return parsed;
  }

  @Override protected Response post(HttpUrl endpoint, byte[] body,
    Map<String, String> headers, int timeoutMillis) throws IOException {
    Call call = client.newCall(newRequest(endpoint, body, headers));
    if (timeoutMillis > 0) call.timeout().timeout(timeoutMillis, MILLISECONDS);
    try (okhttp3.Response response = call.execute()) {
      ResponseBody responseBody = response.body();
      String content = responseBody != null ? responseBody.string() : "";
      return Response.create(response.code(), response.header("Location"),
        content);
    }
  }

  static Request newRequest(HttpUrl endpoint, byte[] body, Map<String, String> headers) {
    MediaType contentType = NDJSON;
    Request.Builder request = new Request.Builder().url(endpoint);
    for (Map.Entry<String, String> header : headers.entrySet()) {
      if ("Content-Type".equalsIgnoreCase(header.getKey())) {
        // the body's media type becomes the header
        MediaType parsed = MediaType.parse(header.getValue());
        if (parsed != null) contentType = parsed;
      } else {
        request.header(header.getKey(), header.getValue());
      }
    }
    return request.post(RequestBody.create(body, contentType)).build();
  }

  /** Waits up to a second for in-flight requests to finish before cancelling them */
  @Override protected void doClose() {
    client.dispatcher().executorService().shutdown();
    try {
      if (!client.dispatcher().executorService().awaitTermination(1, TimeUnit.SECONDS)) {
        client.dispatcher().cancelAll();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    client.connectionPool().evictAll();
  }

  @Override public String toString() {
    return "OkHttpSender{" + endpoint + "}";
  }

  /** Routes each request according to {@link ProxySettings#proxyFor(String)}. */
  static final class ProxySettingsSelector extends ProxySelector {
    final ProxySettings proxySettings;

    ProxySettingsSelector(ProxySettings proxySettings) {
      this.proxySettings = proxySettings;
    }

    @Override public List<Proxy> select(URI uri) {
      return Collections.singletonList(proxySettings.proxyFor(uri.getHost()));
    }

    @Override public void connectFailed(URI uri, SocketAddress address, IOException failure) {
      // OkHttp tracks failed routes itself
    }
  }
}
