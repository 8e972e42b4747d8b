package com.flamingo.ai.quotes.agent;

import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.exception.ClassificationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retry policy shared by every classification call: a fixed number of attempts with a quadratic
 * wait (n squared backoff units before attempt n+1). Exhausting the attempts raises {@link
 * ClassificationException}.
 */
@Component
@Slf4j
public class ClassificationRetryPolicy {

  private final RetryRegistry retryRegistry;
  private final MeterRegistry meterRegistry;
  private final RetryConfig retryConfig;
  private final int maxAttempts;
  private final Map<String, Retry> retries = new ConcurrentHashMap<>();

  public ClassificationRetryPolicy(
      RetryRegistry retryRegistry, MeterRegistry meterRegistry, IngestionProperties properties) {
    this.retryRegistry = retryRegistry;
    this.meterRegistry = meterRegistry;
    this.maxAttempts = properties.getRetry().getMaxAttempts();
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(quadraticBackoff(properties.getRetry().getBackoffUnit()))
            .build();
  }

  /**
   * Runs a call under the policy.
   *
   * @param operation name of the call, used for logs and metrics
   * @param call the call; any runtime exception counts as a failed attempt
   * @return the first successful result
   * @throws ClassificationException when every attempt failed
   */
  public <T> T execute(String operation, Supplier<T> call) {
    Retry retry = retryFor(operation);
    try {
      return Retry.decorateSupplier(retry, call).get();
    } catch (RuntimeException e) {
      throw new ClassificationException(operation, maxAttempts, e);
    }
  }

  Retry retryFor(String operation) {
    return retries.computeIfAbsent(operation, this::createRetry);
  }

  private Retry createRetry(String operation) {
    Retry retry = retryRegistry.retry(operation, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("classification.attempts.failed", "operation", operation)
                  .increment();
              log.warn(
                  "{} failed (attempt {}/{}), retrying in {} ms: {}",
                  operation,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getWaitInterval().toMillis(),
                  describe(event.getLastThrowable()));
            })
        .onError(
            event -> {
              meterRegistry.counter("classification.attempts.failed", "operation", operation)
                  .increment();
              log.error(
                  "{} failed after {} attempts: {}",
                  operation,
                  event.getNumberOfRetryAttempts(),
                  describe(event.getLastThrowable()));
            });
    return retry;
  }

  /** Waits n squared units before attempt n+1. */
  static IntervalFunction quadraticBackoff(Duration unit) {
    long unitMillis = unit.toMillis();
    return attempt -> unitMillis * attempt * attempt;
  }

  private static String describe(Throwable throwable) {
    return throwable == null ? "unknown error" : throwable.getMessage();
  }
}
