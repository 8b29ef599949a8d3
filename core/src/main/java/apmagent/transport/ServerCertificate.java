/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import apmagent.transport.internal.InsecureTls;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okio.ByteString;

/**
 * Pins the APM Server to one certificate: a connection is trusted only when the server presents a
 * certificate whose SHA-256 fingerprint matches. Certificate authorities and the host name are
 * not checked, which suits self-signed servers.
 *
 * <pre>{@code
 * sender = OkHttpSender.newBuilder()
 *   .endpoint("https://apm-server:8200/intake/v2/events")
 *   .serverCert(ServerCertificate.fromPemFile(Paths.get("/etc/apm/server.pem")))
 *   .build();
 * }</pre>
 */
public final class ServerCertificate {

  public static ServerCertificate fromPemFile(Path path) throws IOException {
    if (path == null) throw new NullPointerException("path == null");
    return fromPem(new String(Files.readAllBytes(path), StandardCharsets.US_ASCII));
  }

  /** Parses the first certificate of PEM text, starting with "-----BEGIN CERTIFICATE-----". */
  public static ServerCertificate fromPem(String pem) {
    if (pem == null) throw new NullPointerException("pem == null");
    try {
      CertificateFactory factory = CertificateFactory.getInstance("X.509");
      return create((X509Certificate) factory.generateCertificate(
        new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII))));
    } catch (CertificateException e) {
      throw new IllegalArgumentException("invalid PEM certificate: " + e.getMessage(), e);
    }
  }

  public static ServerCertificate create(X509Certificate certificate) {
    if (certificate == null) throw new NullPointerException("certificate == null");
    try {
      return new ServerCertificate(fingerprint(certificate));
    } catch (CertificateEncodingException e) {
      throw new IllegalArgumentException("unencodable certificate: " + e.getMessage(), e);
    }
  }

  /** Lowercase hex SHA-256 of the DER encoding. */
  static String fingerprint(X509Certificate certificate) throws CertificateEncodingException {
    return ByteString.of(certificate.getEncoded()).sha256().hex();
  }

  final String fingerprint;
  final X509TrustManager trustManager;
  volatile SSLSocketFactory socketFactory;

  ServerCertificate(String fingerprint) {
    this.fingerprint = fingerprint;
    this.trustManager = new PinnedTrustManager(fingerprint);
  }

  /** Lowercase hex SHA-256 fingerprint of the pinned certificate. */
  public String fingerprint() {
    return fingerprint;
  }

  /** Trusts a server only if the first certificate of its chain is the pinned one. */
  public X509TrustManager trustManager() {
    return trustManager;
  }

  /** Accepts any host name, as the certificate itself is pinned. */
  public HostnameVerifier hostnameVerifier() {
    return InsecureTls.hostnameVerifier();
  }

  /** Lazily creates a socket factory that uses the {@link #trustManager() pinned trust manager}. */
  public SSLSocketFactory socketFactory() {
    SSLSocketFactory result = socketFactory;
    if (result != null) return result;
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {trustManager}, new SecureRandom());
      return socketFactory = context.getSocketFactory();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to create an SSL context: " + e.getMessage(), e);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof ServerCertificate)) return false;
    return fingerprint.equals(((ServerCertificate) o).fingerprint);
  }

  @Override public int hashCode() {
    return fingerprint.hashCode();
  }

  @Override public String toString() {
    return "ServerCertificate{sha256=" + fingerprint + "}";
  }

  static final class PinnedTrustManager implements X509TrustManager {
    final String fingerprint;

    PinnedTrustManager(String fingerprint) {
      this.fingerprint = fingerprint;
    }

    @Override public void checkClientTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
      throw new CertificateException("client certificates are not supported");
    }

    @Override public void checkServerTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
      if (chain == null || chain.length == 0) {
        throw new CertificateException("server presented no certificate");
      }
      String actual = fingerprint(chain[0]);
      if (!fingerprint.equals(actual)) {
        throw new CertificateException(
          "server certificate fingerprint " + actual + " does not match " + fingerprint);
      }
    }

    @Override public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }

    @Override public String toString() {
      return "PinnedTrustManager{sha256=" + fingerprint + "}";
    }
  }
}
