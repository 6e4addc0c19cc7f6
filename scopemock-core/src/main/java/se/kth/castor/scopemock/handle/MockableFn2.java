package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.handle.Functions.Fn2;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of a target whose argument tuple has 2 values: a static method with 2 parameters or an
 * instance method with 1 parameter and its receiver.
 *
 * @param <A> the type of the first value of the argument tuple, the receiver for instance methods
 * @param <B> the type of the second value
 * @param <R> the result type, the resolved value type for asynchronous targets
 */
public final class MockableFn2<A, B, R> extends AbstractMockable {

  private MockableFn2(MockTarget target, MockRegistry registry) {
    super(target, registry, 2);
  }

  public static <A, B, R> MockableFn2<A, B, R> function(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.STATIC));
  }

  public static <A, B, R> MockableFn2<A, B, R> method(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.INSTANCE));
  }

  public static <A, B, R> MockableFn2<A, B, R> of(MockTarget target) {
    return of(target, MockRegistry.global());
  }

  public static <A, B, R> MockableFn2<A, B, R> of(MockTarget target, MockRegistry registry) {
    return new MockableFn2<>(target, registry);
  }

  @SuppressWarnings("unchecked")
  public MockGuard setMock(Fn2<A, B, R> mock) {
    Objects.requireNonNull(mock, "mock");
    return install(arguments -> mock.apply((A) arguments[0], (B) arguments[1]));
  }

  public R call(A a, B b, Fn2<A, B, R> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invoke(active.get(), a, b);
    }
    return original.apply(a, b);
  }

  public CompletableFuture<R> callAsync(
      A a, B b,
      Fn2<A, B, CompletableFuture<R>> original
  ) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invokeAsync(active.get(), a, b);
    }
    return original.apply(a, b);
  }
}
