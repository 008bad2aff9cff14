package streamtrace.communication.transport;

import java.io.InputStream;

/**
 * Sends one request body to the collector. The body is pulled from {@code stream} until it
 * reports end-of-stream, which is the normal way for a request to finish.
 *
 * <p>Implementations must be usable from a single sender thread and must not throw; every outcome
 * is reported through the returned {@link Response}.
 */
public interface StreamTransport {

  Response sendStream(SendContext context, InputStream stream);
}
