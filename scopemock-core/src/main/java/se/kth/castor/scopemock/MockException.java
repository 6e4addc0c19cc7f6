package se.kth.castor.scopemock;

public class MockException extends RuntimeException {

  private final Type type;

  public MockException(Type type, String context) {
    super(type.name() + ": " + context);
    this.type = type;
  }

  public MockException(Type type, String context, Throwable cause) {
    super(type.name() + ": " + context, cause);
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  public enum Type {
    /**
     * The named method does not exist on the given type.
     */
    UNKNOWN_TARGET,
    /**
     * A typed handle takes a different number of arguments than the target's argument tuple.
     */
    ARITY_MISMATCH,
    /**
     * A handle for static methods was requested for an instance method or vice versa.
     */
    KIND_MISMATCH,
    /**
     * A guard was released while a guard installed after it was still active. Only raised when
     * {@link ReleaseOrder#STRICT} is configured.
     */
    OUT_OF_ORDER_RELEASE,
    INVALID_CONFIGURATION,
    AGENT_UNAVAILABLE,
  }

}
