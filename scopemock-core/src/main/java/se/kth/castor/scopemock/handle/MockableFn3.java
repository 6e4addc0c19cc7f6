package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.handle.Functions.Fn3;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of a target whose argument tuple has 3 values: a static method with 3 parameters or an
 * instance method with 2 parameters and its receiver.
 *
 * @param <A> the type of the first value of the argument tuple, the receiver for instance methods
 * @param <B> the type of the second value
 * @param <C> the type of the third value
 * @param <R> the result type, the resolved value type for asynchronous targets
 */
public final class MockableFn3<A, B, C, R> extends AbstractMockable {

  private MockableFn3(MockTarget target, MockRegistry registry) {
    super(target, registry, 3);
  }

  public static <A, B, C, R> MockableFn3<A, B, C, R> function(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.STATIC));
  }

  public static <A, B, C, R> MockableFn3<A, B, C, R> method(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.INSTANCE));
  }

  public static <A, B, C, R> MockableFn3<A, B, C, R> of(MockTarget target) {
    return of(target, MockRegistry.global());
  }

  public static <A, B, C, R> MockableFn3<A, B, C, R> of(
      MockTarget target,
      MockRegistry registry
  ) {
    return new MockableFn3<>(target, registry);
  }

  @SuppressWarnings("unchecked")
  public MockGuard setMock(Fn3<A, B, C, R> mock) {
    Objects.requireNonNull(mock, "mock");
    return install(arguments -> mock.apply((A) arguments[0], (B) arguments[1], (C) arguments[2]));
  }

  public R call(A a, B b, C c, Fn3<A, B, C, R> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invoke(active.get(), a, b, c);
    }
    return original.apply(a, b, c);
  }

  public CompletableFuture<R> callAsync(
      A a, B b, C c,
      Fn3<A, B, C, CompletableFuture<R>> original
  ) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invokeAsync(active.get(), a, b, c);
    }
    return original.apply(a, b, c);
  }
}
