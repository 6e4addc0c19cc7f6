package se.kth.castor.scopemock.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Wraps a {@link Lock} so it can be held with try-with-resources.
 */
public class ClosableLock {

  private final Lock underlying;

  public ClosableLock(Lock underlying) {
    this.underlying = underlying;
  }

  /**
   * {@return the read half of the given lock}
   *
   * @param lock the read-write lock
   */
  public static ClosableLock readingFrom(ReadWriteLock lock) {
    return new ClosableLock(lock.readLock());
  }

  /**
   * {@return the write half of the given lock}
   *
   * @param lock the read-write lock
   */
  public static ClosableLock writingTo(ReadWriteLock lock) {
    return new ClosableLock(lock.writeLock());
  }

  public UnexceptionalAutoClosable lock() {
    return new LockGuard();
  }

  public interface UnexceptionalAutoClosable extends AutoCloseable {

    @Override
    void close();

  }

  private class LockGuard implements UnexceptionalAutoClosable {

    public LockGuard() {
      underlying.lock();
    }

    @Override
    public void close() {
      underlying.unlock();
    }
  }
}
