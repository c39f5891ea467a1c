package com.cario.insight.app.storage;

import com.cario.insight.app.exception.StorageException;
import com.cario.insight.app.exception.StorageNotFoundException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;

/**
 * Retries transient {@link StorageException}s of a delegate with exponential backoff. Not-found
 * errors are final and surface immediately.
 */
@Log4j2
public class RetryingImageStorage implements ImageStorage {

  private final ImageStorage delegate;
  private final Retry retry;

  public RetryingImageStorage(ImageStorage delegate, int maxAttempts, Duration initialBackoff) {
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, maxAttempts))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
            .retryOnException(
                ex -> ex instanceof StorageException && !(ex instanceof StorageNotFoundException))
            .build();
    this.retry = Retry.of("image-storage", config);
    this.retry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "storage.retry attempt={}/{} wait={}ms msg={}",
                    e.getNumberOfRetryAttempts(),
                    maxAttempts,
                    e.getWaitInterval().toMillis(),
                    e.getLastThrowable() == null ? null : e.getLastThrowable().getMessage()));
  }

  @Override
  public String save(byte[] bytes, String suggestedName) {
    return call(() -> delegate.save(bytes, suggestedName));
  }

  @Override
  public void saveAs(String key, byte[] bytes, String contentType) {
    call(
        () -> {
          delegate.saveAs(key, bytes, contentType);
          return null;
        });
  }

  @Override
  public byte[] fetch(String key) {
    return call(() -> delegate.fetch(key));
  }

  @Override
  public void delete(String key) {
    call(
        () -> {
          delegate.delete(key);
          return null;
        });
  }

  @Override
  public Optional<String> publicUrl(String key) {
    return delegate.publicUrl(key);
  }

  @Override
  public Optional<String> signedUrl(String key, Duration ttl) {
    return delegate.signedUrl(key, ttl);
  }

  @Override
  public boolean isAvailable() {
    return delegate.isAvailable();
  }

  public ImageStorage getDelegate() {
    return delegate;
  }

  private <T> T call(Supplier<T> op) {
    return Retry.decorateSupplier(retry, op).get();
  }
}
