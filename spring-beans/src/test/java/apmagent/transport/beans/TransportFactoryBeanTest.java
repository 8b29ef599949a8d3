/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.beans;

import apmagent.transport.BackoffStrategy;
import apmagent.transport.EventKind;
import apmagent.transport.InMemoryTransportMetrics;
import apmagent.transport.Transport;
import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import okio.GzipSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

class TransportFactoryBeanTest {
  static final String SENDER = ""
    + "<bean id=\"sender\" class=\"apmagent.transport.beans.EventSenderFactoryBean\">\n"
    + "  <property name=\"endpoint\" value=\"http://localhost:8200/intake/v2/events\"/>\n"
    + "</bean>";

  XmlBeans context;
  MockWebServer server;

  @AfterEach void close() throws IOException {
    if (context != null) context.close();
    if (server != null) server.close();
  }

  @Test void sender() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("sender")
      .isSameAs(context.getBean("sender", Object.class));
  }

  @Test void defaults() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("compressionLevel", "maxFlushTimeNanos", "maxBufferSize", "sendTimeoutMillis",
        "async", "transportState.backoff")
      .containsExactly(5, TimeUnit.SECONDS.toNanos(10), 768 * 1024, 20_000, true,
        BackoffStrategy.QUADRATIC);
  }

  @Test void settings() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"compressionLevel\" value=\"9\"/>\n"
      + "  <property name=\"maxFlushTime\" value=\"500\"/>\n"
      + "  <property name=\"maxBufferSize\" value=\"1024\"/>\n"
      + "  <property name=\"sendTimeout\" value=\"2000\"/>\n"
      + "  <property name=\"async\" value=\"false\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("compressionLevel", "maxFlushTimeNanos", "maxBufferSize", "sendTimeoutMillis",
        "async")
      .containsExactly(9, TimeUnit.MILLISECONDS.toNanos(500), 1024, 2000, false);
  }

  @Test void metadata() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"metadata\">\n"
      + "    <map>\n"
      + "      <entry key=\"service\">\n"
      + "        <map>\n"
      + "          <entry key=\"name\" value=\"checkout\"/>\n"
      + "        </map>\n"
      + "      </entry>\n"
      + "    </map>\n"
      + "  </property>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("metadataLine")
      .satisfies(line -> assertThat(new String((byte[]) line, UTF_8))
        .isEqualTo("{\"metadata\":{\"service\":{\"name\":\"checkout\"}}}"));
  }

  @Test void secretToken() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"secretToken\" value=\"s3cr3t\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("headers")
      .asInstanceOf(MAP)
      .containsEntry("Authorization", "Bearer s3cr3t");
  }

  @Test void apiKey_winsOverSecretToken() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"secretToken\" value=\"s3cr3t\"/>\n"
      + "  <property name=\"apiKey\" value=\"k3y\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("headers")
      .asInstanceOf(MAP)
      .containsEntry("Authorization", "ApiKey k3y");
  }

  @Test void headers() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"headers\">\n"
      + "    <map>\n"
      + "      <entry key=\"User-Agent\" value=\"apm-agent-java/1.0\"/>\n"
      + "    </map>\n"
      + "  </property>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("headers")
      .asInstanceOf(MAP)
      .containsExactly(
        entry("Content-Type", "application/x-ndjson"),
        entry("Content-Encoding", "gzip"),
        entry("User-Agent", "apm-agent-java/1.0"));
  }

  @Test void backoff_byName() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"backoff\" value=\"EXPONENTIAL\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("transportState.backoff")
      .isSameAs(BackoffStrategy.EXPONENTIAL);
  }

  @Test void backoff_byReference() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"none\" class=\"apmagent.transport.beans.TransportFactoryBeanTest\""
      + " factory-method=\"noBackoff\"/>\n"
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"backoff\" ref=\"none\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("transportState.backoff")
      .isSameAs(BackoffStrategy.NONE);
  }

  static BackoffStrategy noBackoff() {
    return BackoffStrategy.NONE;
  }

  @Test void backoff_unknownName() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"backoff\" value=\"LINEAR\"/>\n"
      + "</bean>"
    );

    assertThatThrownBy(() -> context.getBean("transport", Transport.class))
      .isInstanceOf(BeanCreationException.class)
      .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test void metrics() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"metrics\" class=\"apmagent.transport.InMemoryTransportMetrics\"/>\n"
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"metrics\" ref=\"metrics\"/>\n"
      + "</bean>"
    );

    assertThat(context.getBean("transport", Transport.class))
      .extracting("metrics")
      .isSameAs(context.getBean("metrics", InMemoryTransportMetrics.class));
  }

  @Test void close_closesTransport() {
    context = new XmlBeans(SENDER, ""
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "</bean>"
    );

    Transport transport = context.getBean("transport", Transport.class);
    context.close();

    assertThat(transport.isClosed()).isTrue();
  }

  @Test void deliversWithAuthorization() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(202));
    context = new XmlBeans(""
      + "<bean id=\"sender\" class=\"apmagent.transport.beans.EventSenderFactoryBean\">\n"
      + "  <property name=\"type\" value=\"OKHTTP\"/>\n"
      + "  <property name=\"endpoint\" value=\"" + server.url("/intake/v2/events") + "\"/>\n"
      + "</bean>\n"
      + "<bean id=\"transport\" class=\"apmagent.transport.beans.TransportFactoryBean\">\n"
      + "  <property name=\"sender\" ref=\"sender\"/>\n"
      + "  <property name=\"secretToken\" value=\"s3cr3t\"/>\n"
      + "  <property name=\"async\" value=\"false\"/>\n"
      + "</bean>"
    );

    Transport transport = context.getBean("transport", Transport.class);
    transport.queue(EventKind.TRANSACTION, Collections.singletonMap("id", "abc"));
    transport.flush(true);

    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer s3cr3t");
    Buffer body = new Buffer();
    body.writeAll(new GzipSource(request.getBody()));
    assertThat(body.readUtf8()).endsWith("{\"transaction\":{\"id\":\"abc\"}}\n");
  }
}
