package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.handle.Functions.Fn1;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of a target whose argument tuple has a single value: a static method with one parameter
 * or an instance method without parameters, whose receiver is the single value.
 *
 * @param <A> the type of the first value of the argument tuple, the receiver for instance methods
 * @param <R> the result type, the resolved value type for asynchronous targets
 */
public final class MockableFn1<A, R> extends AbstractMockable {

  private MockableFn1(MockTarget target, MockRegistry registry) {
    super(target, registry, 1);
  }

  public static <A, R> MockableFn1<A, R> function(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.STATIC));
  }

  public static <A, R> MockableFn1<A, R> method(
      Class<?> owner,
      String name,
      Class<?>... parameterTypes
  ) {
    return of(requireKind(MockTarget.of(owner, name, parameterTypes), Kind.INSTANCE));
  }

  public static <A, R> MockableFn1<A, R> of(MockTarget target) {
    return of(target, MockRegistry.global());
  }

  public static <A, R> MockableFn1<A, R> of(MockTarget target, MockRegistry registry) {
    return new MockableFn1<>(target, registry);
  }

  @SuppressWarnings("unchecked")
  public MockGuard setMock(Fn1<A, R> mock) {
    Objects.requireNonNull(mock, "mock");
    return install(arguments -> mock.apply((A) arguments[0]));
  }

  public R call(A a, Fn1<A, R> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invoke(active.get(), a);
    }
    return original.apply(a);
  }

  public CompletableFuture<R> callAsync(
      A a,
      Fn1<A, CompletableFuture<R>> original
  ) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invokeAsync(active.get(), a);
    }
    return original.apply(a);
  }
}
