package se.kth.castor.scopemock.handle;

import se.kth.castor.scopemock.MockException;
import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.MockTarget.Kind;
import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.OverrideSlot;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Shared plumbing of the typed handles.
 * <p>
 * A handle is what a rewritten method holds on to: it owns the slot reference (the storage), it
 * dispatches calls either to the innermost override or to the original body (the rewritten
 * callable), and it installs typed closures (the setter).
 */
public abstract class AbstractMockable {

  private final MockTarget target;
  private final OverrideSlot slot;

  protected AbstractMockable(MockTarget target, MockRegistry registry, int arity) {
    this.target = Objects.requireNonNull(target, "target");
    if (target.tupleArity() != arity) {
      throw new MockException(
          Type.ARITY_MISMATCH,
          target + " takes " + target.tupleArity() + " values"
          + (target.kind() == Kind.INSTANCE ? " including the receiver" : "")
          + ", the handle passes " + arity
      );
    }
    this.slot = registry.slotFor(target);
  }

  protected static MockTarget requireKind(MockTarget target, Kind kind) {
    if (target.kind() != kind) {
      throw new MockException(
          Type.KIND_MISMATCH,
          target + " is " + target.kind().name().toLowerCase(Locale.ROOT) + ", expected "
          + kind.name().toLowerCase(Locale.ROOT)
      );
    }
    return target;
  }

  public MockTarget target() {
    return target;
  }

  public boolean isMocked() {
    return slot.peek().isPresent();
  }

  protected MockGuard install(OverrideRecord record) {
    return slot.override(record);
  }

  protected Optional<OverrideRecord> active() {
    return slot.peek();
  }

  /**
   * Applies an override. Checked exceptions can only come from records installed through the
   * registry directly, they are wrapped in an {@link UndeclaredThrowableException}.
   */
  @SuppressWarnings("unchecked")
  protected static <R> R invoke(OverrideRecord record, Object... tuple) {
    try {
      return (R) record.apply(tuple);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable e) {
      throw new UndeclaredThrowableException(e);
    }
  }

  /**
   * Applies an override on behalf of an asynchronous target. The result is available
   * immediately; a throwing override yields a failed future, as a throwing async body would.
   */
  @SuppressWarnings("unchecked")
  protected static <R> CompletableFuture<R> invokeAsync(OverrideRecord record, Object... tuple) {
    try {
      return CompletableFuture.completedFuture((R) record.apply(tuple));
    } catch (Throwable e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + target + "}";
  }
}
