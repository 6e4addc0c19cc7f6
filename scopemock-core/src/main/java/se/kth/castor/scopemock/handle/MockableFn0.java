package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.handle.Functions.Fn0;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of a static method without parameters.
 *
 * @param <R> the result type, the resolved value type for asynchronous targets
 */
public final class MockableFn0<R> extends AbstractMockable {

  private MockableFn0(MockTarget target, MockRegistry registry) {
    super(target, registry, 0);
  }

  public static <R> MockableFn0<R> function(Class<?> owner, String name) {
    return of(requireKind(MockTarget.of(owner, name), Kind.STATIC));
  }

  public static <R> MockableFn0<R> of(MockTarget target) {
    return of(target, MockRegistry.global());
  }

  public static <R> MockableFn0<R> of(MockTarget target, MockRegistry registry) {
    return new MockableFn0<>(target, registry);
  }

  public MockGuard setMock(Fn0<R> mock) {
    Objects.requireNonNull(mock, "mock");
    return install(arguments -> mock.apply());
  }

  public R call(Fn0<R> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invoke(active.get());
    }
    return original.apply();
  }

  public CompletableFuture<R> callAsync(Fn0<CompletableFuture<R>> original) {
    Optional<OverrideRecord> active = active();
    if (active.isPresent()) {
      return invokeAsync(active.get());
    }
    return original.apply();
  }
}
