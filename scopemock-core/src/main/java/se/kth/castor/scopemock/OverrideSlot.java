package se.kth.castor.scopemock;

import com.google.common.collect.MapMaker;
import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.util.ClosableLock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the active overrides of a single {@link MockTarget}.
 * <p>
 * Overrides form a stack per execution context, innermost last. The rewritten method only ever
 * consults the top of the stack for the context it runs in. Entries are removed by the token
 * their install returned, so releasing an outer override while an inner one is active leaves the
 * inner one in place.
 * <p>
 * All operations on one slot are serialized. Operations on different slots never contend.
 */
public class OverrideSlot {

  private static final AtomicLong TOKEN_SEQUENCE = new AtomicLong();

  private final MockTarget target;
  private final SlotScope scope;
  private final ReleaseOrder releaseOrder;
  private final boolean verbose;
  // keyed by identity, finished threads are dropped with their stacks
  private final Map<Object, Deque<Entry>> stacks;
  private final ClosableLock readLock;
  private final ClosableLock writeLock;

  public OverrideSlot(
      MockTarget target,
      SlotScope scope,
      ReleaseOrder releaseOrder,
      boolean verbose
  ) {
    this.target = Objects.requireNonNull(target, "target");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.releaseOrder = Objects.requireNonNull(releaseOrder, "releaseOrder");
    this.verbose = verbose;
    this.stacks = new MapMaker().weakKeys().makeMap();

    ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    this.readLock = ClosableLock.readingFrom(lock);
    this.writeLock = ClosableLock.writingTo(lock);
  }

  public OverrideSlot(MockTarget target, SlotScope scope) {
    this(target, scope, ReleaseOrder.ANY, false);
  }

  /**
   * Pushes an override for the current execution context.
   *
   * @param record the override
   * @return the token identifying this push, needed to {@link #restore(Token) restore} it
   */
  public Token install(OverrideRecord record) {
    Objects.requireNonNull(record, "record");
    Token token = new Token(scope.contextKey(), TOKEN_SEQUENCE.incrementAndGet());

    int depth;
    try (var ignored = writeLock.lock()) {
      Deque<Entry> stack = stacks.computeIfAbsent(token.context, ignoredKey -> new ArrayDeque<>());
      stack.addLast(new Entry(token, record));
      depth = stack.size();
    }
    trace("(+)", depth);
    return token;
  }

  /**
   * Removes the override a token installed. Restoring a token twice, or a token of another slot,
   * has no effect.
   *
   * @param token the token returned by {@link #install(OverrideRecord)}
   * @throws MockException of type {@link Type#OUT_OF_ORDER_RELEASE} if the token was not the
   *     innermost override and {@link ReleaseOrder#STRICT} is configured. The override is removed
   *     nonetheless.
   */
  public void restore(Token token) {
    boolean wasInnermost;
    int depth;
    try (var ignored = writeLock.lock()) {
      Deque<Entry> stack = stacks.get(token.context);
      if (stack == null || stack.isEmpty()) {
        return;
      }
      wasInnermost = stack.peekLast().token() == token;
      if (!remove(stack, token)) {
        return;
      }
      depth = stack.size();
      if (stack.isEmpty()) {
        stacks.remove(token.context);
      }
    }
    trace("(-)", depth);

    if (!wasInnermost && releaseOrder == ReleaseOrder.STRICT) {
      throw new MockException(
          Type.OUT_OF_ORDER_RELEASE,
          target + " was released while a later override was still active"
      );
    }
  }

  private static boolean remove(Deque<Entry> stack, Token token) {
    Iterator<Entry> iterator = stack.descendingIterator();
    while (iterator.hasNext()) {
      if (iterator.next().token() == token) {
        iterator.remove();
        return true;
      }
    }
    return false;
  }

  /**
   * {@return the innermost override of the current execution context, if any}
   */
  public Optional<OverrideRecord> peek() {
    try (var ignored = readLock.lock()) {
      Deque<Entry> stack = stacks.get(scope.contextKey());
      if (stack == null || stack.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(stack.peekLast().record());
    }
  }

  /**
   * Installs an override and wraps the token in a guard.
   *
   * @param record the override
   * @return the guard restoring the slot when closed
   */
  public MockGuard override(OverrideRecord record) {
    return new MockGuard(this, install(record));
  }

  /**
   * {@return the number of active overrides in the current execution context}
   */
  public int depth() {
    try (var ignored = readLock.lock()) {
      Deque<Entry> stack = stacks.get(scope.contextKey());
      return stack == null ? 0 : stack.size();
    }
  }

  public MockTarget target() {
    return target;
  }

  public SlotScope scope() {
    return scope;
  }

  private void trace(String marker, int depth) {
    if (verbose) {
      System.err.println(
          "  ".repeat(Math.max(depth - 1, 0)) + marker + " " + target.shortName()
          + " [" + Thread.currentThread().getName() + ", depth " + depth + "]"
      );
    }
  }

  /**
   * Identifies a single install. Compared by identity.
   */
  public static final class Token {

    private final Object context;
    private final long sequence;

    private Token(Object context, long sequence) {
      this.context = context;
      this.sequence = sequence;
    }

    @Override
    public String toString() {
      return "Token{" + sequence + "@" + context + "}";
    }
  }

  private record Entry(Token token, OverrideRecord record) {

  }
}
