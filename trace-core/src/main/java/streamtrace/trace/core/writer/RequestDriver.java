package streamtrace.trace.core.writer;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static streamtrace.trace.util.AgentThreadFactory.AgentThread.REQUEST_SENDER;
import static streamtrace.trace.util.AgentThreadFactory.THREAD_JOIN_TIMOUT_MS;
import static streamtrace.trace.util.AgentThreadFactory.newAgentThread;

import java.io.InputStream;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.communication.transport.Response;
import streamtrace.communication.transport.SendContext;
import streamtrace.communication.transport.StreamTransport;

/**
 * Performs the blocking sends, one at a time, on its own thread. A send waits out the jittered
 * grace period it was handed before the transport starts pulling the body.
 */
final class RequestDriver implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RequestDriver.class);

  private static final SendRequest STOP = new SendRequest(GracePeriod.NONE, null);

  private final BlockingQueue<SendRequest> requests = new ArrayBlockingQueue<>(2);
  private final StreamTransport transport;
  private final SendContext context;
  private final Consumer<Response> results;
  private final Thread thread;

  RequestDriver(StreamTransport transport, SendContext context, Consumer<Response> results) {
    this.transport = transport;
    this.context = context;
    this.results = results;
    this.thread = newAgentThread(REQUEST_SENDER, new SendingTask());
  }

  void start() {
    thread.start();
  }

  /** Only called when no other send is outstanding. */
  void send(long gracePeriodNanos, InputStream body) {
    if (!requests.offer(new SendRequest(gracePeriodNanos, body))) {
      throw new IllegalStateException("A send is already outstanding");
    }
  }

  @Override
  public void close() {
    requests.offer(STOP);
    try {
      thread.join(THREAD_JOIN_TIMOUT_MS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private Response sendOne(SendRequest request) throws InterruptedException {
    if (request.gracePeriodNanos > 0) {
      long delay = GracePeriod.jitter(request.gracePeriodNanos, ThreadLocalRandom.current());
      if (!context.await(delay, NANOSECONDS)) {
        return Response.ended();
      }
    }
    try {
      return transport.sendStream(context, request.body);
    } catch (Throwable e) {
      log.debug("Transport failed unexpectedly", e);
      return Response.failed(e);
    }
  }

  private final class SendingTask implements Runnable {
    @Override
    public void run() {
      try {
        SendRequest request;
        while ((request = requests.take()) != STOP) {
          results.accept(sendOne(request));
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      log.debug("Request sender exited");
    }
  }

  private static final class SendRequest {
    final long gracePeriodNanos;
    final InputStream body;

    SendRequest(long gracePeriodNanos, InputStream body) {
      this.gracePeriodNanos = gracePeriodNanos;
      this.body = body;
    }
  }
}
