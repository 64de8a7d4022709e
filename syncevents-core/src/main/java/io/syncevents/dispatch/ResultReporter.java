package io.syncevents.dispatch;

import io.syncevents.spi.DispatchMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs and counts handler results. Nothing is rethrown: a failing handler
 * never affects the others.
 */
public final class ResultReporter {
  private static final Logger logger = Logger.getLogger(ResultReporter.class.getName());

  private final DispatchMetrics metrics;

  public ResultReporter(DispatchMetrics metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reports one result. Failures and aborts are logged at SEVERE exactly once.
   *
   * @param result the result
   */
  public void report(HandlerResult result) {
    if (result instanceof HandlerResult.Success) {
      metrics.incrementHandlerSuccess();
    } else if (result instanceof HandlerResult.Failure failure) {
      metrics.incrementHandlerFailure();
      logger.log(Level.SEVERE, "Event handler for `" + failure.tag() + "` failed: " + failure.message());
    } else if (result instanceof HandlerResult.Aborted aborted) {
      metrics.incrementHandlerAborted();
      logger.log(Level.SEVERE, "Event handler for `" + aborted.tag() + "` terminated abnormally",
          aborted.error());
    }
  }
}
