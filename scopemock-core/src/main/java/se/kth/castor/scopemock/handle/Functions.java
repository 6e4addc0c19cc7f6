package se.kth.castor.scopemock.handle;

/**
 * Closure shapes accepted by the typed handles. For instance methods the first type parameter is
 * the receiver.
 */
public final class Functions {

  private Functions() {
  }

  @FunctionalInterface
  public interface Fn0<R> {

    R apply();
  }

  @FunctionalInterface
  public interface Fn1<A, R> {

    R apply(A a);
  }

  @FunctionalInterface
  public interface Fn2<A, B, R> {

    R apply(A a, B b);
  }

  @FunctionalInterface
  public interface Fn3<A, B, C, R> {

    R apply(A a, B b, C c);
  }

  @FunctionalInterface
  public interface Fn4<A, B, C, D, R> {

    R apply(A a, B b, C c, D d);
  }
}
