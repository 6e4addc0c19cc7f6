package se.kth.castor.scopemock;

import se.kth.castor.scopemock.OverrideSlot.Token;
import se.kth.castor.scopemock.util.ClosableLock.UnexceptionalAutoClosable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps an override active until it is closed. Closing restores whatever the target resolved to
 * before the override was installed. Only the first {@link #close()} has an effect.
 * <p>
 * Use it with try-with-resources so the override is removed on every exit path:
 * <pre>{@code
 * try (MockGuard ignored = ADD.setMock((a, b) -> a * 10 + b)) {
 *   assertThat(Calculator.add(2, 3)).isEqualTo(23);
 * }
 * }</pre>
 */
public final class MockGuard implements UnexceptionalAutoClosable {

  private final OverrideSlot slot;
  private final Token token;
  private final AtomicBoolean released;

  MockGuard(OverrideSlot slot, Token token) {
    this.slot = slot;
    this.token = token;
    this.released = new AtomicBoolean();
  }

  public MockTarget target() {
    return slot.target();
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      slot.restore(token);
    }
  }

  @Override
  public String toString() {
    return "MockGuard{" + slot.target().setterName() + ", "
           + (isReleased() ? "released" : "active") + "}";
  }
}
