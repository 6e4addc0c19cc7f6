package se.kth.castor.scopemock;

import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.util.Classes;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.apache.commons.lang3.StringUtils;

/**
 * Identifies one overridable method. Two targets are equal if they share the declaring class, the
 * method name and the parameter types; {@link #kind()} and {@link #async()} are derived from the
 * method and take no part in equality.
 *
 * @param declaringClassName the fully qualified name of the declaring class
 * @param methodName the name of the method
 * @param parameterTypes the fully qualified names of the declared parameter types
 * @param kind whether the method has a receiver
 * @param async whether the method returns a {@link CompletableFuture} compatible stage
 */
public record MockTarget(
    String declaringClassName,
    String methodName,
    List<String> parameterTypes,
    Kind kind,
    boolean async
) {

  public MockTarget {
    Objects.requireNonNull(declaringClassName, "declaringClassName");
    Objects.requireNonNull(methodName, "methodName");
    Objects.requireNonNull(kind, "kind");
    parameterTypes = List.copyOf(parameterTypes);
  }

  /**
   * Resolves a declared method and returns its target.
   *
   * @param owner the declaring type
   * @param methodName the name of the method
   * @param parameterTypes the declared parameter types, used to pick an overload
   * @return the target
   * @throws MockException of type {@link Type#UNKNOWN_TARGET} if no such method is declared
   */
  public static MockTarget of(Class<?> owner, String methodName, Class<?>... parameterTypes) {
    try {
      return fromReflectMethod(owner.getDeclaredMethod(methodName, parameterTypes));
    } catch (NoSuchMethodException e) {
      throw new MockException(
          Type.UNKNOWN_TARGET,
          Classes.className(owner) + "#" + methodName + "("
          + String.join(",", Arrays.stream(parameterTypes).map(Classes::className).toList())
          + ")",
          e
      );
    }
  }

  public static MockTarget fromReflectMethod(Method method) {
    return new MockTarget(
        Classes.className(method.getDeclaringClass()),
        method.getName(),
        Arrays.stream(method.getParameterTypes()).map(Classes::className).toList(),
        Modifier.isStatic(method.getModifiers()) ? Kind.STATIC : Kind.INSTANCE,
        isAsyncReturnType(method.getReturnType())
    );
  }

  private static boolean isAsyncReturnType(Class<?> returnType) {
    return CompletionStage.class.isAssignableFrom(returnType)
           && returnType.isAssignableFrom(CompletableFuture.class);
  }

  /**
   * {@return the number of values an override receives: the parameters, prefixed by the receiver
   * for instance methods}
   */
  public int tupleArity() {
    return parameterTypes.size() + (kind == Kind.INSTANCE ? 1 : 0);
  }

  /**
   * {@return the conventional name of the setter for this target, e.g. {@code setMockFetchData}}
   */
  public String setterName() {
    return "setMock" + StringUtils.capitalize(methodName);
  }

  public String signature() {
    return methodName + "(" + String.join(",", parameterTypes) + ")";
  }

  public String fqnWithSignature() {
    return declaringClassName + "#" + signature();
  }

  public String shortName() {
    return Classes.unqualify(declaringClassName) + "#" + methodName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MockTarget that)) {
      return false;
    }
    return declaringClassName.equals(that.declaringClassName)
           && methodName.equals(that.methodName)
           && parameterTypes.equals(that.parameterTypes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(declaringClassName, methodName, parameterTypes);
  }

  @Override
  public String toString() {
    return fqnWithSignature();
  }

  public enum Kind {
    STATIC,
    INSTANCE
  }
}
