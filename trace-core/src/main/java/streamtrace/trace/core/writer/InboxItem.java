package streamtrace.trace.core.writer;

import java.util.concurrent.CompletableFuture;
import streamtrace.communication.transport.Response;
import streamtrace.trace.core.config.TracerConfigCommand;
import streamtrace.trace.core.metrics.Metrics;

/** Control messages for the tracer loop. Records travel on a separate queue. */
interface InboxItem {}

abstract class SignalItem implements InboxItem {
  final CompletableFuture<Boolean> future;

  SignalItem() {
    this.future = new CompletableFuture<>();
  }

  void complete() {
    this.future.complete(true);
  }

  void ignore() {
    this.future.complete(false);
  }

  static final class FlushSignal extends SignalItem {}

  static final class SendMetricsSignal extends SignalItem {}
}

final class ConfigCommandItem implements InboxItem {
  final TracerConfigCommand command;

  ConfigCommandItem(TracerConfigCommand command) {
    this.command = command;
  }
}

/** Outcome of the request most recently handed to the request driver. */
final class SendResult implements InboxItem {
  final Response response;

  SendResult(Response response) {
    this.response = response;
  }
}

/** A gather cycle finished filling {@code metrics}. */
final class MetricsGathered implements InboxItem {
  final Metrics metrics;

  MetricsGathered(Metrics metrics) {
    this.metrics = metrics;
  }
}
