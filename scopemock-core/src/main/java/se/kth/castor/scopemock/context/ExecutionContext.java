package se.kth.castor.scopemock.context;

import java.util.function.Supplier;

/**
 * Determines which execution context an override belongs to. By default every thread is its own
 * context. Task based runners, or tests handing work to other threads, can bind an explicit key
 * so that several threads observe the same overrides.
 */
public class ExecutionContext {

  private static final ThreadLocal<Object> BOUND_KEY = new ThreadLocal<>();
  private static final Object SHARED = new Object() {
    @Override
    public String toString() {
      return "shared";
    }
  };

  /**
   * {@return the key bound to this thread, or the thread itself if none is bound}
   */
  public static Object current() {
    Object bound = BOUND_KEY.get();
    return bound != null ? bound : Thread.currentThread();
  }

  /**
   * {@return the single key used by process wide slots}
   */
  public static Object shared() {
    return SHARED;
  }

  /**
   * Binds the given key to the current thread until the returned binding is closed.
   *
   * @param key the context key, compared by identity
   * @return a binding restoring the previously bound key on close
   */
  public static Binding bind(Object key) {
    if (key == null) {
      throw new NullPointerException("key");
    }
    Binding binding = new Binding(BOUND_KEY.get());
    BOUND_KEY.set(key);
    return binding;
  }

  /**
   * {@return a runnable executing {@code task} in the context that is current at the time of this
   * call, regardless of the thread it later runs on}
   *
   * @param task the task to wrap
   */
  public static Runnable wrap(Runnable task) {
    Object captured = current();
    return () -> {
      try (var ignored = bind(captured)) {
        task.run();
      }
    };
  }

  /**
   * {@return a supplier evaluating {@code task} in the context that is current at the time of
   * this call}
   *
   * @param task the task to wrap
   * @param <T> the result type
   */
  public static <T> Supplier<T> wrap(Supplier<T> task) {
    Object captured = current();
    return () -> {
      try (var ignored = bind(captured)) {
        return task.get();
      }
    };
  }

  private static void restore(Object previous) {
    if (previous == null) {
      BOUND_KEY.remove();
    } else {
      BOUND_KEY.set(previous);
    }
  }

  public record Binding(Object previous) implements AutoCloseable {

    @Override
    public void close() {
      ExecutionContext.restore(previous);
    }

  }
}
