/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.internal;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

/**
 * TLS components that accept any certificate and any host name. Only used when server certificate
 * verification was explicitly disabled, for example against a self-signed APM Server.
 */
public final class InsecureTls {
  static final X509TrustManager TRUST_ALL = new X509TrustManager() {
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {
    }

    @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {
    }

    @Override public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }

    @Override public String toString() {
      return "TrustAllTrustManager";
    }
  };

  static final HostnameVerifier ANY_HOST = (hostname, session) -> true;

  static volatile SSLSocketFactory socketFactory;

  public static X509TrustManager trustManager() {
    return TRUST_ALL;
  }

  public static HostnameVerifier hostnameVerifier() {
    return ANY_HOST;
  }

  /** Lazily creates a socket factory that trusts {@link #trustManager() any certificate}. */
  public static SSLSocketFactory socketFactory() {
    SSLSocketFactory result = socketFactory;
    if (result != null) return result;
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {TRUST_ALL}, new SecureRandom());
      return socketFactory = context.getSocketFactory();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to create an SSL context: " + e.getMessage(), e);
    }
  }

  InsecureTls() {
  }
}
