package streamtrace.trace.api;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class IOLoggerTest {

  @Test
  void successIsSilentWithoutDebug() {
    Logger log = mock(Logger.class);
    IOLogger ioLogger = new IOLogger(log, mock(RatelimitedLogger.class));

    assertFalse(ioLogger.success("sent {}", 1));
  }

  @Test
  void successAfterLoggedErrorIsInfo() {
    Logger log = mock(Logger.class);
    when(log.isInfoEnabled()).thenReturn(true);
    RatelimitedLogger ratelimited = mock(RatelimitedLogger.class);
    when(ratelimited.warn(anyString(), any(), any(), any())).thenReturn(true);
    IOLogger ioLogger = new IOLogger(log, ratelimited);

    assertTrue(ioLogger.error("Failed to send", new IOException("boom")));
    assertTrue(ioLogger.success("sent {}", 1));
    assertFalse(ioLogger.success("sent {}", 2));

    verify(log).info("sent {}", new Object[] {1});
  }

  @Test
  void responseErrorIncludesStatus() {
    Logger log = mock(Logger.class);
    RatelimitedLogger ratelimited = mock(RatelimitedLogger.class);
    IOLogger ioLogger = new IOLogger(log, ratelimited);

    ioLogger.error("Failed to send", new IOLogger.Response(503, "Unavailable", "busy"));

    verify(ratelimited)
        .warn(eq("{} Status: {} {}"), eq("Failed to send"), eq(503), eq("Unavailable"));
  }

  @Test
  void debugLogsFullDetail() {
    Logger log = mock(Logger.class);
    when(log.isDebugEnabled()).thenReturn(true);
    IOLogger ioLogger = new IOLogger(log, mock(RatelimitedLogger.class));
    IOException failure = new IOException("boom");

    assertTrue(ioLogger.error("Failed to send", failure));

    verify(log).debug("Failed to send", failure);
  }
}
