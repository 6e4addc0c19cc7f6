package se.kth.castor.scopemock;

/**
 * A substitute implementation for one target, in normalized form.
 * <p>
 * Every target shape is reduced to a function from an argument tuple to a result. For instance
 * methods the receiver is the first element of the tuple. Asynchronous targets use the plain
 * resolved value as result; the caller wraps it into an already completed future.
 */
@FunctionalInterface
public interface OverrideRecord {

  /**
   * Computes the result of an overridden invocation.
   *
   * @param arguments the argument tuple, receiver first for instance methods
   * @return the result of the invocation, {@code null} for void targets
   * @throws Throwable whatever the substitute throws, propagated unchanged to the caller
   */
  Object apply(Object[] arguments) throws Throwable;

}
