package streamtrace.trace.core;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** A setting read on the tracing hot path and changed rarely. */
final class ReadWriteSetting<T> {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private T value;

  ReadWriteSetting(T value) {
    this.value = value;
  }

  T get() {
    lock.readLock().lock();
    try {
      return value;
    } finally {
      lock.readLock().unlock();
    }
  }

  void set(T value) {
    lock.writeLock().lock();
    try {
      this.value = value;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
