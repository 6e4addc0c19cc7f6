package se.kth.castor.scopemock.agent;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;

/**
 * Runtime entry points of rewritten methods. Called from the advice inlined into every
 * {@link se.kth.castor.scopemock.Mockable} method, so everything here has to be public.
 */
public final class MockDispatch {

  private static final LoadingCache<Method, MockTarget> TARGETS = CacheBuilder.newBuilder()
      .build(CacheLoader.from(MockTarget::fromReflectMethod));

  private MockDispatch() {
  }

  /**
   * {@return the innermost override of the method for the current context, {@code null} if the
   * original body should run}
   *
   * @param method the rewritten method
   */
  public static OverrideRecord lookup(Method method) {
    return MockRegistry.global().peek(TARGETS.getUnchecked(method)).orElse(null);
  }

  /**
   * Computes the result of an overridden invocation.
   *
   * @param record the override returned by {@link #lookup(Method)}
   * @param method the rewritten method
   * @param receiver the receiver, {@code null} for static methods
   * @param arguments the invocation arguments
   * @return the value the rewritten method returns
   * @throws Throwable whatever a synchronous override throws
   */
  public static Object invoke(
      OverrideRecord record,
      Method method,
      Object receiver,
      Object[] arguments
  ) throws Throwable {
    MockTarget target = TARGETS.getUnchecked(method);
    Object[] tuple = target.kind() == Kind.INSTANCE ? prepend(receiver, arguments) : arguments;
    if (!target.async()) {
      return record.apply(tuple);
    }
    try {
      return CompletableFuture.completedFuture(record.apply(tuple));
    } catch (Throwable e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static Object[] prepend(Object receiver, Object[] arguments) {
    Object[] tuple = new Object[arguments.length + 1];
    tuple[0] = receiver;
    System.arraycopy(arguments, 0, tuple, 1, arguments.length);
    return tuple;
  }
}
