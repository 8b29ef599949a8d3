/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.beans;

import apmagent.transport.BackoffStrategy;
import apmagent.transport.DeliveryCallback;
import apmagent.transport.EventSender;
import apmagent.transport.Transport;
import apmagent.transport.TransportMetrics;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.config.AbstractFactoryBean;

/**
 * Spring XML config does not support chained builders. This converts accordingly.
 *
 * <p>When both are set, {@code apiKey} takes precedence over {@code secretToken} for the
 * "Authorization" header.
 */
public class TransportFactoryBean extends AbstractFactoryBean {
  EventSender sender;
  Map<String, ?> metadata;
  Map<String, String> headers;
  String secretToken, apiKey;
  Integer compressionLevel;
  Integer maxFlushTime;
  Integer maxBufferSize;
  Integer sendTimeout;
  Boolean async;
  TransportMetrics metrics;
  DeliveryCallback callback;
  BackoffStrategy backoff;

  @Override public Class<? extends Transport> getObjectType() {
    return Transport.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  @Override protected Transport createInstance() {
    Transport.Builder builder = Transport.newBuilder(sender);
    if (metadata != null) builder.metadata(metadata);
    if (headers != null) {
      for (Map.Entry<String, String> header : headers.entrySet()) {
        builder.header(header.getKey(), header.getValue());
      }
    }
    if (apiKey != null) {
      builder.header("Authorization", "ApiKey " + apiKey);
    } else if (secretToken != null) {
      builder.header("Authorization", "Bearer " + secretToken);
    }
    if (compressionLevel != null) builder.compressionLevel(compressionLevel);
    if (maxFlushTime != null) builder.maxFlushTime(maxFlushTime, TimeUnit.MILLISECONDS);
    if (maxBufferSize != null) builder.maxBufferSize(maxBufferSize);
    if (sendTimeout != null) builder.sendTimeout(sendTimeout, TimeUnit.MILLISECONDS);
    if (async != null) builder.async(async);
    if (metrics != null) builder.metrics(metrics);
    if (callback != null) builder.callback(callback);
    if (backoff != null) builder.backoff(backoff);
    return builder.build();
  }

  @Override protected void destroyInstance(Object instance) {
    ((Transport) instance).close();
  }

  public void setSender(EventSender sender) {
    this.sender = sender;
  }

  public void setMetadata(Map<String, ?> metadata) {
    this.metadata = metadata;
  }

  public void setHeaders(Map<String, String> headers) {
    this.headers = headers;
  }

  public void setSecretToken(String secretToken) {
    this.secretToken = secretToken;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public void setCompressionLevel(Integer compressionLevel) {
    this.compressionLevel = compressionLevel;
  }

  /** In milliseconds. */
  public void setMaxFlushTime(Integer maxFlushTime) {
    this.maxFlushTime = maxFlushTime;
  }

  public void setMaxBufferSize(Integer maxBufferSize) {
    this.maxBufferSize = maxBufferSize;
  }

  /** In milliseconds. */
  public void setSendTimeout(Integer sendTimeout) {
    this.sendTimeout = sendTimeout;
  }

  public void setAsync(Boolean async) {
    this.async = async;
  }

  public void setMetrics(TransportMetrics metrics) {
    this.metrics = metrics;
  }

  public void setCallback(DeliveryCallback callback) {
    this.callback = callback;
  }

  // Object to allow built-in strategy names.
  public void setBackoff(Object backoff) {
    if (backoff instanceof String) {
      this.backoff = backoffStrategy(backoff.toString());
    } else if (backoff instanceof BackoffStrategy) {
      this.backoff = (BackoffStrategy) backoff;
    } else if (backoff != null) {
      throw new IllegalArgumentException("unsupported backoff: " + backoff);
    }
  }

  static BackoffStrategy backoffStrategy(String name) {
    switch (name) {
      case "NONE":
        return BackoffStrategy.NONE;
      case "QUADRATIC":
        return BackoffStrategy.QUADRATIC;
      case "EXPONENTIAL":
        return BackoffStrategy.EXPONENTIAL;
      default:
        throw new IllegalArgumentException("unknown backoff: " + name);
    }
  }
}
