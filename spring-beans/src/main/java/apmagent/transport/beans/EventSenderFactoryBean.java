/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.beans;

import apmagent.transport.EventSender;
import apmagent.transport.ProxySettings;
import apmagent.transport.ServerCertificate;
import java.io.IOException;
import java.nio.file.Paths;
import org.springframework.beans.factory.config.AbstractFactoryBean;

/** Spring XML config does not support chained builders. This converts accordingly */
public class EventSenderFactoryBean extends AbstractFactoryBean {
  SenderType type = SenderType.URLCONNECTION;
  String endpoint;
  Integer connectTimeout;
  Boolean verifyServerCert;
  String serverCert;
  ProxySettings proxySettings;

  @Override protected EventSender createInstance() throws IOException {
    if (endpoint == null) throw new IllegalArgumentException("endpoint is required");
    return type.create(endpoint, connectTimeout,
      verifyServerCert == null || verifyServerCert,
      serverCert != null ? ServerCertificate.fromPemFile(Paths.get(serverCert)) : null,
      proxySettings != null ? proxySettings : ProxySettings.fromEnvironment());
  }

  @Override public Class<? extends EventSender> getObjectType() {
    return EventSender.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  @Override protected void destroyInstance(Object instance) {
    ((EventSender) instance).close();
  }

  /** Defaults to {@link SenderType#URLCONNECTION}. */
  public void setType(SenderType type) {
    this.type = type;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint;
  }

  public void setConnectTimeout(Integer connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public void setVerifyServerCert(Boolean verifyServerCert) {
    this.verifyServerCert = verifyServerCert;
  }

  /** Path to the PEM file of the APM Server's certificate. When set, connections are pinned to it. */
  public void setServerCert(String serverCert) {
    this.serverCert = serverCert;
  }

  public void setProxySettings(ProxySettings proxySettings) {
    this.proxySettings = proxySettings;
  }
}
