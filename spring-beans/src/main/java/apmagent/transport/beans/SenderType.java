/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.beans;

import apmagent.transport.EventSender;
import apmagent.transport.ProxySettings;
import apmagent.transport.ServerCertificate;
import apmagent.transport.okhttp3.OkHttpSender;
import apmagent.transport.urlconnection.URLConnectionSender;

/** HTTP client used to post batches. */
public enum SenderType {
  /** Blocking {@link java.net.HttpURLConnection}, with no dependencies beyond the JRE. */
  URLCONNECTION {
    @Override EventSender create(String endpoint, Integer connectTimeout,
      boolean verifyServerCert, ServerCertificate serverCert, ProxySettings proxySettings) {
      URLConnectionSender.Builder builder = URLConnectionSender.newBuilder()
        .endpoint(endpoint)
        .verifyServerCert(verifyServerCert)
        .serverCert(serverCert)
        .proxySettings(proxySettings);
      if (connectTimeout != null) builder.connectTimeout(connectTimeout);
      return builder.build();
    }
  },
  /** OkHttp, which pools connections. */
  OKHTTP {
    @Override EventSender create(String endpoint, Integer connectTimeout,
      boolean verifyServerCert, ServerCertificate serverCert, ProxySettings proxySettings) {
      OkHttpSender.Builder builder = OkHttpSender.newBuilder()
        .endpoint(endpoint)
        .verifyServerCert(verifyServerCert)
        .serverCert(serverCert)
        .proxySettings(proxySettings);
      if (connectTimeout != null) builder.connectTimeout(connectTimeout);
      return builder.build();
    }
  };

  abstract EventSender create(String endpoint, Integer connectTimeout, boolean verifyServerCert,
    ServerCertificate serverCert, ProxySettings proxySettings);
}
