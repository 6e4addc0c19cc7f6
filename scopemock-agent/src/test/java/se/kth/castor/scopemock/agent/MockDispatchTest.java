package se.kth.castor.scopemock.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import examples.Greeting;
import examples.Pricing;
import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import se.kth.castor.scopemock.MockGuard;
import se.kth.castor.scopemock.MockRegistry;
import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.OverrideRecord;

class MockDispatchTest {

  @Test
  void lookupFindsInnermostOverride() throws Exception {
    Method add = Pricing.class.getDeclaredMethod("add", int.class, int.class);
    MockTarget target = MockTarget.fromReflectMethod(add);
    OverrideRecord record = args -> 1;

    assertThat(MockDispatch.lookup(add)).isNull();
    try (MockGuard ignored = MockRegistry.global().install(target, record)) {
      assertThat(MockDispatch.lookup(add)).isSameAs(record);
    }
    assertThat(MockDispatch.lookup(add)).isNull();
  }

  @Test
  void staticTupleHasArgumentsOnly() throws Throwable {
    Method add = Pricing.class.getDeclaredMethod("add", int.class, int.class);
    OverrideRecord record = mock(OverrideRecord.class);
    when(record.apply(any())).thenReturn(9);

    Object result = MockDispatch.invoke(record, add, null, new Object[]{4, 5});

    ArgumentCaptor<Object[]> tuple = ArgumentCaptor.forClass(Object[].class);
    verify(record).apply(tuple.capture());
    assertThat(tuple.getValue()).containsExactly(4, 5);
    assertThat(result).isEqualTo(9);
  }

  @Test
  void instanceTupleStartsWithReceiver() throws Throwable {
    Method greet = Greeting.class.getDeclaredMethod("greet", String.class);
    Greeting receiver = new Greeting("Hi");
    OverrideRecord record = mock(OverrideRecord.class);
    when(record.apply(any())).thenReturn("mocked");

    Object result = MockDispatch.invoke(record, greet, receiver, new Object[]{"Ada"});

    ArgumentCaptor<Object[]> tuple = ArgumentCaptor.forClass(Object[].class);
    verify(record).apply(tuple.capture());
    assertThat(tuple.getValue()).containsExactly(receiver, "Ada");
    assertThat(result).isEqualTo("mocked");
  }

  @Test
  @SuppressWarnings("unchecked")
  void asyncResultIsCompletedFuture() throws Throwable {
    Method quote = Pricing.class.getDeclaredMethod("quote", String.class);

    Object result = MockDispatch.invoke(args -> 7, quote, null, new Object[]{"sku"});

    assertThat((CompletableFuture<Integer>) result).isCompletedWithValue(7);
  }

  @Test
  @SuppressWarnings("unchecked")
  void asyncFailureIsFailedFuture() throws Throwable {
    Method quote = Pricing.class.getDeclaredMethod("quote", String.class);

    Object result = MockDispatch.invoke(
        args -> {
          throw new IllegalStateException("down");
        },
        quote,
        null,
        new Object[]{"sku"}
    );

    assertThat((CompletableFuture<Integer>) result).isCompletedExceptionally();
  }

  @Test
  void syncFailurePropagates() throws Exception {
    Method add = Pricing.class.getDeclaredMethod("add", int.class, int.class);

    assertThatThrownBy(() -> MockDispatch.invoke(
        args -> {
          throw new IllegalStateException("down");
        },
        add,
        null,
        new Object[]{1, 2}
    )).isInstanceOf(IllegalStateException.class);
  }
}
