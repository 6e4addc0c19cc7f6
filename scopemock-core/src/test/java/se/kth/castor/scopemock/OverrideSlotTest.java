package se.kth.castor.scopemock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import examples.Calculator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.OverrideSlot.Token;

class OverrideSlotTest {

  private MockTarget target;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    target = MockTarget.of(Calculator.class, "subtract", int.class, int.class);
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void emptySlotHasNoOverride() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);

    assertThat(slot.peek()).isEmpty();
    assertThat(slot.depth()).isZero();
  }

  @Test
  void innermostOverrideWins() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);

    Token outer = slot.install(args -> "outer");
    Token inner = slot.install(args -> "inner");
    assertThat(resultOf(slot)).isEqualTo("inner");
    assertThat(slot.depth()).isEqualTo(2);

    slot.restore(inner);
    assertThat(resultOf(slot)).isEqualTo("outer");

    slot.restore(outer);
    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void outOfOrderReleaseKeepsInnerOverride() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);

    Token outer = slot.install(args -> "outer");
    Token inner = slot.install(args -> "inner");

    slot.restore(outer);
    assertThat(resultOf(slot)).isEqualTo("inner");
    assertThat(slot.depth()).isEqualTo(1);

    slot.restore(inner);
    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void strictOrderRejectsOutOfOrderRelease() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD, ReleaseOrder.STRICT, false);

    Token outer = slot.install(args -> "outer");
    Token inner = slot.install(args -> "inner");

    assertThatThrownBy(() -> slot.restore(outer))
        .isInstanceOfSatisfying(
            MockException.class,
            e -> assertThat(e.getType()).isEqualTo(Type.OUT_OF_ORDER_RELEASE)
        );
    // removed nonetheless
    assertThat(slot.depth()).isEqualTo(1);
    assertThat(resultOf(slot)).isEqualTo("inner");

    slot.restore(inner);
    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void restoringTwiceHasNoEffect() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD, ReleaseOrder.STRICT, false);

    Token outer = slot.install(args -> "outer");
    Token inner = slot.install(args -> "inner");
    slot.restore(inner);
    slot.restore(inner);

    assertThat(resultOf(slot)).isEqualTo("outer");
    slot.restore(outer);
    slot.restore(outer);
    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void tokenOfOtherSlotIsIgnored() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);
    OverrideSlot other = new OverrideSlot(target, SlotScope.THREAD);

    slot.install(args -> "mine");
    Token foreign = other.install(args -> "theirs");

    slot.restore(foreign);
    assertThat(slot.depth()).isEqualTo(1);
  }

  @Test
  void threadScopeIsolatesThreads() throws Exception {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);
    Token token = slot.install(args -> "main");

    Future<Optional<OverrideRecord>> seenByWorker = executor.submit(slot::peek);

    assertThat(seenByWorker.get(5, TimeUnit.SECONDS)).isEmpty();
    assertThat(slot.peek()).isPresent();
    slot.restore(token);
  }

  @Test
  void concurrentThreadsSeeTheirOwnOverride() throws Exception {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);
    CountDownLatch bothInstalled = new CountDownLatch(2);

    Future<Object> first = executor.submit(() -> installAndPeek(slot, "first", bothInstalled));
    Future<Object> second = executor.submit(() -> installAndPeek(slot, "second", bothInstalled));

    assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
    assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void globalScopeIsShared() throws Exception {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.GLOBAL);
    Token token = slot.install(args -> "everywhere");

    Future<Optional<OverrideRecord>> seenByWorker = executor.submit(slot::peek);

    assertThat(seenByWorker.get(5, TimeUnit.SECONDS)).isPresent();
    slot.restore(token);
    assertThat(executor.submit(slot::peek).get(5, TimeUnit.SECONDS)).isEmpty();
  }

  @Test
  void tokenCanBeRestoredFromAnotherThread() throws Exception {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);
    Token token = slot.install(args -> "main");

    CompletableFuture.runAsync(() -> slot.restore(token), executor).get(5, TimeUnit.SECONDS);

    assertThat(slot.peek()).isEmpty();
  }

  @Test
  void overrideReturnsGuard() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD);

    try (MockGuard guard = slot.override(args -> 1)) {
      assertThat(guard.target()).isEqualTo(target);
      assertThat(slot.depth()).isEqualTo(1);
    }
    assertThat(slot.depth()).isZero();
  }

  @Test
  void verboseSlotStillWorks() {
    OverrideSlot slot = new OverrideSlot(target, SlotScope.THREAD, ReleaseOrder.ANY, true);

    try (MockGuard ignored = slot.override(args -> "traced")) {
      assertThat(resultOf(slot)).isEqualTo("traced");
    }
    assertThat(slot.peek()).isEmpty();
  }

  private static Object installAndPeek(OverrideSlot slot, String value, CountDownLatch latch)
      throws InterruptedException {
    Token token = slot.install(args -> value);
    try {
      latch.countDown();
      latch.await(5, TimeUnit.SECONDS);
      return resultOf(slot);
    } finally {
      slot.restore(token);
    }
  }

  private static Object resultOf(OverrideSlot slot) {
    try {
      return slot.peek().orElseThrow().apply(new Object[0]);
    } catch (Throwable e) {
      throw new AssertionError(e);
    }
  }
}
