/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URL;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Posts batches to the APM Server intake endpoint, and classifies the outcome the same way
 * regardless of the HTTP client used.
 *
 * <ul>
 *   <li>A timeout is an expected failure, raised without asking for a stack trace.</li>
 *   <li>HTTP 429 means the server is rate limiting, also expected.</li>
 *   <li>Any other status of 400 or above, or any I/O failure, is a noteworthy error.</li>
 * </ul>
 *
 * <p>Calls to {@linkplain #post} usually happen on the transport's dispatch worker, but
 * {@linkplain #close()} might be called from any thread.
 *
 * @param <U> The URL type for the HTTP client, such as {@linkplain URL} or {@linkplain URI}.
 */
public abstract class BaseHttpSender<U> implements EventSender {
  static final Logger logger = Logger.getLogger(BaseHttpSender.class.getName());

  /** What {@link #post} read from the collector. */
  public static final class Response {
    public static Response create(int statusCode, String location, String body) {
      return new Response(statusCode, location, body);
    }

    final int statusCode;
    final String location, body;

    Response(int statusCode, String location, String body) {
      this.statusCode = statusCode;
      this.location = location;
      this.body = body != null ? body : "";
    }

    public int statusCode() {
      return statusCode;
    }

    /** The "Location" header, or null. */
    public String location() {
      return location;
    }

    /** The response body decoded as UTF-8, or empty. */
    public String body() {
      return body;
    }
  }

  protected final U endpoint;

  /** close is typically called from a different thread */
  final AtomicBoolean closeCalled = new AtomicBoolean();

  protected BaseHttpSender(String endpoint) {
    if (endpoint == null) throw new NullPointerException("endpoint == null");
    this.endpoint = newEndpoint(endpoint);
  }

  /** Implementations should perform any validation needed here. */
  protected abstract U newEndpoint(String endpoint);

  /**
   * Implement to POST the gzipped batch to the endpoint, returning the response status. Throw
   * {@link InterruptedIOException}, or its subtype {@link java.net.SocketTimeoutException}, when
   * the timeout elapsed.
   */
  protected abstract Response post(U endpoint, byte[] body, Map<String, String> headers,
    int timeoutMillis) throws IOException;

  /** Override to close any resources. */
  protected void doClose() {
  }

  @Override public final String send(byte[] body, Map<String, String> headers, int timeoutMillis)
    throws TransportException {
    if (closeCalled.get()) throw new ClosedSenderException();
    if (body == null) throw new NullPointerException("body == null");
    if (headers == null) headers = Collections.emptyMap();

    Response response;
    try {
      response = post(endpoint, body, headers, timeoutMillis);
    } catch (InterruptedIOException e) {
      throw TransportException.timeout(
        format("Connection to APM Server timed out (url: %s, timeout: %s seconds)", endpoint,
          timeoutMillis / 1000.0), body, e);
    } catch (IOException e) {
      throw TransportException.unreachable(
        format("Unable to reach APM Server: %s (url: %s)", e, endpoint), body, e);
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format("Sent request, url=%s size=%.2fkb status=%s", endpoint,
        body.length / 1024.0, response.statusCode));
    }

    int status = response.statusCode;
    if (status >= 400) {
      String message = status == 429 ? "Temporarily rate limited: " : "HTTP " + status + ": ";
      throw TransportException.httpError(message + response.body, body, status);
    }
    return response.location;
  }

  @Override public final void close() {
    if (!closeCalled.compareAndSet(false, true)) return; // already closed
    doClose();
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + endpoint + "}";
  }
}
