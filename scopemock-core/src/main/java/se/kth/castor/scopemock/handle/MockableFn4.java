package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.handle.Functions.Fn4;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of a target whose argument tuple has 4 values: a static method with 4 parameters or an
 * instance method with 3 parameters and its receiver.
 *
 * @param <A> the type of the first value of the argument tuple, the receiver for instance methods
 * @param <B> the type of the second value
 * @param <C> the type of the third value
 * @param <D> the type of the fourth value
 * @param <R> the result type, the resolved value type for asynchronous targets
 */
public final class MockableFn4<A, B, C, D, R> extends AbstractMockable {

  private MockableFn4(MockTarget target, MockRegistry registry) {
    super(target, registry, 4);
  }

  public static <A, B, C, D, R> MockableFn4<A, B, C, D, R> function(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.STATIC));
  }

  public static <A, B, C, D, R> MockableFn4<A, B, C, D, R> method(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.INSTANCE));
  }

  public static <A, B, C, D, R> MockableFn4<A, B, C, D, R> of(MockTarget target) {
    return of(target, MockRegistry.global());
  }

  public static <A, B, C, D, R> MockableFn4<A, B, C, D, R> of(
      MockTarget target,
      MockRegistry registry
  ) {
    return new MockableFn4<>(target, registry);
  }

  @SuppressWarnings("unchecked")
  public MockGuard setMock(Fn4<A, B, C, D, R> mock) {
    Objects.requireNonNull(mock, "mock");
    return install(arguments -> mock.apply(
        (A) arguments[0],
        (B) arguments[1],
        (C) arguments[2],
        (D) arguments[3]
    ));
  }

  public R call(A a, B b, C c, D d, Fn4<A, B, C, D, R> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invoke(active.get(), a, b, c, d);
    }
    return original.apply(a, b, c, d);
  }

  public CompletableFuture<R> callAsync(
      A a, B b, C c, D d,
      Fn4<A, B, C, D, CompletableFuture<R>> original
  ) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invokeAsync(active.get(), a, b, c, d);
    }
    return original.apply(a, b, c, d);
  }
}
