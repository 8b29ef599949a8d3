/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.okhttp3;

import apmagent.transport.ClosedSenderException;
import apmagent.transport.DeliveryCallback;
import apmagent.transport.EventKind;
import apmagent.transport.InMemoryTransportMetrics;
import apmagent.transport.ProxySettings;
import apmagent.transport.ServerCertificate;
import apmagent.transport.Transport;
import apmagent.transport.TransportException;
import com.squareup.moshi.JsonReader;
import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import okio.Buffer;
import okio.BufferedSource;
import okio.GzipSource;
import okio.Okio;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OkHttpSenderTest {
  static final byte[] BODY = {1, 2, 3};

  MockWebServer server = new MockWebServer();
  String endpoint = server.url("/intake/v2/events").toString();
  OkHttpSender sender = OkHttpSender.newBuilder()
    .endpoint(endpoint)
    .proxySettings(ProxySettings.NONE)
    .build();

  @AfterEach void closeServer() throws IOException {
    sender.close();
    server.close();
  }

  @Test void send_returnsLocation() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202).setHeader("Location", "/1"));

    Map<String, String> headers = new HashMap<>();
    headers.put("Content-Type", "application/x-ndjson");
    headers.put("Content-Encoding", "gzip");
    headers.put("Authorization", "ApiKey abc");
    assertThat(sender.send(BODY, headers, 1000)).isEqualTo("/1");

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/intake/v2/events");
    assertThat(request.getHeader("Content-Type")).isEqualTo("application/x-ndjson");
    assertThat(request.getHeader("Content-Encoding")).isEqualTo("gzip");
    assertThat(request.getHeader("Authorization")).isEqualTo("ApiKey abc");
    assertThat(request.getBody().readByteArray()).containsExactly(BODY);
  }

  @Test void rateLimited() {
    server.enqueue(new MockResponse().setResponseCode(429).setBody("queue is full"));

    TransportException e = catchThrowableOfType(
      () -> sender.send(BODY, Collections.emptyMap(), 1000), TransportException.class);

    assertThat(e).hasMessage("Temporarily rate limited: queue is full");
    assertThat(e.printTrace()).isFalse();
    assertThat(e.isRateLimited()).isTrue();
  }

  @Test void serverError() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    TransportException e = catchThrowableOfType(
      () -> sender.send(BODY, Collections.emptyMap(), 1000), TransportException.class);

    assertThat(e).hasMessage("HTTP 503: unavailable");
    assertThat(e.printTrace()).isTrue();
  }

  @Test void timeout_boundsTheWholeCall() {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

    long start = System.nanoTime();
    TransportException e = catchThrowableOfType(
      () -> sender.send(BODY, Collections.emptyMap(), 200), TransportException.class);

    assertThat(e.isTimeout()).isTrue();
    assertThat(e.printTrace()).isFalse();
    assertThat(e).hasMessage(
      "Connection to APM Server timed out (url: " + endpoint + ", timeout: 0.2 seconds)");
    assertThat(System.nanoTime() - start).isLessThan(TimeUnit.SECONDS.toNanos(5));
  }

  @Test void unreachable() throws IOException {
    server.shutdown(); // nothing listens anymore

    TransportException e = catchThrowableOfType(
      () -> sender.send(BODY, Collections.emptyMap(), 1000), TransportException.class);

    assertThat(e.printTrace()).isTrue();
    assertThat(e.statusCode()).isEqualTo(-1);
    assertThat(e.getMessage()).startsWith("Unable to reach APM Server: ");
  }

  @Test void proxy() throws Exception {
    Map<String, String> env = new HashMap<>();
    env.put("HTTP_PROXY", server.getHostName() + ":" + server.getPort());
    sender = sender.toBuilder()
      .endpoint("http://apm.example.com:8200/intake/v2/events")
      .proxySettings(ProxySettings.fromEnvironment(env))
      .build();
    server.enqueue(new MockResponse().setResponseCode(202));

    sender.send(BODY, Collections.emptyMap(), 1000);

    assertThat(server.takeRequest().getRequestLine())
      .isEqualTo("POST http://apm.example.com:8200/intake/v2/events HTTP/1.1");
  }

  @Test void verifyServerCert() throws Exception {
    String localhost = InetAddress.getByName("localhost").getCanonicalHostName();
    HeldCertificate selfSigned = new HeldCertificate.Builder()
      .addSubjectAlternativeName(localhost)
      .build();
    HandshakeCertificates serverCertificates = new HandshakeCertificates.Builder()
      .heldCertificate(selfSigned)
      .build();
    server.useHttps(serverCertificates.sslSocketFactory(), false);
    String httpsEndpoint = server.url("/intake/v2/events").toString();

    OkHttpSender verifying = sender.toBuilder().endpoint(httpsEndpoint).build();
    TransportException e = catchThrowableOfType(
      () -> verifying.send(BODY, Collections.emptyMap(), 1000), TransportException.class);
    assertThat(e.printTrace()).isTrue(); // untrusted certificate

    server.enqueue(new MockResponse().setResponseCode(202));
    OkHttpSender insecure =
      sender.toBuilder().endpoint(httpsEndpoint).verifyServerCert(false).build();
    try {
      insecure.send(BODY, Collections.emptyMap(), 1000);
    } finally {
      verifying.close();
      insecure.close();
    }
    assertThat(server.takeRequest().getBody().readByteArray()).containsExactly(BODY);
  }

  @Test void serverCert_pinsCertificateNotHost() throws Exception {
    HeldCertificate apmServer = new HeldCertificate.Builder().commonName("apm-server").build();
    server.useHttps(new HandshakeCertificates.Builder()
      .heldCertificate(apmServer)
      .build().sslSocketFactory(), false);
    server.enqueue(new MockResponse().setResponseCode(202));

    OkHttpSender pinned = sender.toBuilder()
      .endpoint(server.url("/intake/v2/events").toString())
      .serverCert(ServerCertificate.fromPem(apmServer.certificatePem()))
      .build();
    try {
      pinned.send(BODY, Collections.emptyMap(), 1000);
    } finally {
      pinned.close();
    }

    assertThat(server.takeRequest().getBody().readByteArray()).containsExactly(BODY);
  }

  @Test void serverCert_mismatchFailsEvenWithoutVerification() {
    server.useHttps(new HandshakeCertificates.Builder()
      .heldCertificate(new HeldCertificate.Builder().commonName("apm-server").build())
      .build().sslSocketFactory(), false);
    HeldCertificate other = new HeldCertificate.Builder().commonName("apm-server").build();

    OkHttpSender pinned = sender.toBuilder()
      .endpoint(server.url("/intake/v2/events").toString())
      .verifyServerCert(false)
      .serverCert(ServerCertificate.create(other.certificate()))
      .build();
    try {
      TransportException e = catchThrowableOfType(
        () -> pinned.send(BODY, Collections.emptyMap(), 1000), TransportException.class);
      assertThat(e.printTrace()).isTrue();
    } finally {
      pinned.close();
    }
    assertThat(server.getRequestCount()).isZero();
  }

  @Test void transport_asyncDeliveryToServer() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202).setHeader("Location", "/batch/1"));
    AtomicReference<String> location = new AtomicReference<>();
    CountDownLatch delivered = new CountDownLatch(1);
    InMemoryTransportMetrics metrics = new InMemoryTransportMetrics();
    Transport transport = Transport.newBuilder(sender)
      .metadata(Collections.singletonMap("service", Collections.singletonMap("name", "app")))
      .metrics(metrics)
      .callback(new DeliveryCallback() {
        @Override public void onSuccess(String value) {
          location.set(value);
          delivered.countDown();
        }

        @Override public void onError(TransportException error) {
        }
      })
      .build();

    transport.queue(EventKind.TRANSACTION, Collections.singletonMap("id", "t1"));
    transport.queue(EventKind.METRICSET, Collections.singletonMap("samples", Collections.emptyMap()),
      true);

    assertThat(delivered.await(10, TimeUnit.SECONDS)).isTrue();
    transport.close();

    assertThat(location.get()).isEqualTo("/batch/1");
    assertThat(metrics.messages()).isEqualTo(1);
    RecordedRequest request = server.takeRequest();
    assertThat(request.getHeader("Content-Encoding")).isEqualTo("gzip");
    assertThat(gunzipLines(request.getBody().readByteArray())).containsExactly(
      Collections.singletonMap("metadata",
        Collections.singletonMap("service", Collections.singletonMap("name", "app"))),
      Collections.singletonMap("transaction", Collections.singletonMap("id", "t1")),
      Collections.singletonMap("metricset",
        Collections.singletonMap("samples", Collections.emptyMap())));
  }

  @Test void transport_rateLimitedBatchIsDropped() {
    server.enqueue(new MockResponse().setResponseCode(429));
    InMemoryTransportMetrics metrics = new InMemoryTransportMetrics();
    Transport transport = Transport.newBuilder(sender).metrics(metrics).async(false).build();

    transport.queue(EventKind.SPAN, Collections.singletonMap("id", "s1"), true);
    transport.close();

    assertThat(metrics.messagesDropped()).isEqualTo(1);
    assertThat(metrics.eventsDropped()).isEqualTo(1);
  }

  @Test void closedSender() {
    sender.close();

    assertThatThrownBy(() -> sender.send(BODY, Collections.emptyMap(), 1000))
      .isInstanceOf(ClosedSenderException.class);
  }

  @Test void toBuilder() {
    sender = sender.toBuilder().endpoint("http://localhost:29092").build();

    assertThat(sender).hasToString("OkHttpSender{http://localhost:29092/}");
    assertThat(sender.serverCert).isNull();

    ServerCertificate pinned =
      ServerCertificate.create(new HeldCertificate.Builder().build().certificate());
    OkHttpSender withCert = sender.toBuilder().serverCert(pinned).build();
    OkHttpSender rebuilt = withCert.toBuilder().build();
    try {
      assertThat(rebuilt.serverCert).isEqualTo(pinned);
    } finally {
      withCert.close();
      rebuilt.close();
    }
  }

  @Test void invalidEndpoint() {
    assertThatThrownBy(() -> OkHttpSender.create("localhost:8200"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("invalid POST url: localhost:8200");
  }

  @Test void bugGuardCache() {
    assertThat(sender.client.cache())
      .withFailMessage("senders should not open a disk cache")
      .isNull();
  }

  static List<Object> gunzipLines(byte[] gzipped) throws IOException {
    List<Object> result = new ArrayList<>();
    try (BufferedSource source = Okio.buffer(new GzipSource(new Buffer().write(gzipped)))) {
      String line;
      while ((line = source.readUtf8Line()) != null) {
        result.add(JsonReader.of(new Buffer().writeUtf8(line)).readJsonValue());
      }
    }
    return result;
  }
}
