package se.kth.castor.scopemock.handle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import examples.Calculator;
import examples.ValueHolder;
import examples.ValueHolder.DataSource;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import se.kth.castor.scopemock.MockGuard;

class MockableMethodTest {

  @Test
  void methodOverrideReplacesResult() {
    ValueHolder holder = new ValueHolder(7);
    assertThat(holder.value()).isEqualTo(7);

    try (MockGuard ignored = ValueHolder.VALUE.setMock(self -> 20)) {
      assertThat(holder.value()).isEqualTo(20);
    }
    assertThat(holder.value()).isEqualTo(7);
  }

  @Test
  void asyncOverrideResolvesToValue() throws Exception {
    ValueHolder holder = new ValueHolder(7);
    assertThat(holder.asyncValue().get(5, TimeUnit.SECONDS)).isEqualTo(7);

    try (MockGuard ignored = ValueHolder.ASYNC_VALUE.setMock(self -> 20)) {
      CompletableFuture<Integer> result = holder.asyncValue();
      assertThat(result).isCompletedWithValue(20);
    }
    assertThat(holder.asyncValue().get(5, TimeUnit.SECONDS)).isEqualTo(7);
  }

  @Test
  void syncAndAsyncOverridesAreIndependent() throws Exception {
    ValueHolder holder = new ValueHolder(7);

    try (MockGuard ignored = ValueHolder.VALUE.setMock(self -> 20)) {
      assertThat(holder.asyncValue().get(5, TimeUnit.SECONDS)).isEqualTo(7);
      assertThat(Calculator.add(2, 3)).isEqualTo(5);

      try (MockGuard alsoIgnored = ValueHolder.ASYNC_VALUE.setMock(self -> 20)) {
        assertThat(holder.value()).isEqualTo(20);
        assertThat(holder.asyncValue()).isCompletedWithValue(20);
      }
    }
  }

  @Test
  void throwingAsyncOverrideFailsFuture() {
    ValueHolder holder = new ValueHolder(7);

    try (MockGuard ignored = ValueHolder.ASYNC_VALUE.setMock(self -> {
      throw new IllegalStateException("unavailable");
    })) {
      assertThat(holder.asyncValue())
          .isCompletedExceptionally()
          .failsWithin(5, TimeUnit.SECONDS)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  void overrideSeesReceiver() {
    ValueHolder holder = new ValueHolder(7);

    try (MockGuard ignored = ValueHolder.VALUE.setMock(self -> self.x() * 3)) {
      assertThat(holder.value()).isEqualTo(21);
      assertThat(new ValueHolder(2).value()).isEqualTo(6);
    }
  }

  @Test
  void originalCollaboratorIsNotCalledWhileMocked() {
    DataSource source = mock(DataSource.class);
    when(source.fetch(anyString())).thenReturn("remote");
    ValueHolder holder = new ValueHolder(1, source);

    try (MockGuard ignored = ValueHolder.FETCH_DATA.setMock((self, key) -> "cached:" + key)) {
      assertThat(holder.fetchData("users")).isEqualTo("cached:users");
    }
    verify(source, never()).fetch(anyString());

    assertThat(holder.fetchData("users")).isEqualTo("remote");
    verify(source).fetch("users");
  }
}
