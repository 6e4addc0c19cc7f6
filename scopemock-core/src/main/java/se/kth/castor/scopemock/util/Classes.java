package se.kth.castor.scopemock.util;

public class Classes {

  public static String className(Class<?> type) {
    String canonicalName = type.getCanonicalName();
    if (canonicalName != null) {
      // Ensure `$` is used as separator, even if the canonical name actually contains a `.`
      if (type.getDeclaringClass() != null) {
        return className(type.getDeclaringClass()) + "$" + type.getSimpleName();
      }
      if (type.isArray()) {
        return className(type.getComponentType()) + "[]";
      }
      return canonicalName;
    }
    return type.getName();
  }

  /**
   * {@return the simple name of a fully qualified class name, keeping nested type separators}
   *
   * @param className the fully qualified name, as returned by {@link #className(Class)}
   */
  public static String unqualify(String className) {
    int lastDot = className.lastIndexOf('.');
    if (lastDot < 0) {
      return className;
    }
    return className.substring(lastDot + 1);
  }
}
