package examples;

import se.kth.castor.scopemock.handle.MockableFn0;
import se.kth.castor.scopemock.handle.MockableFn2;

public class Calculator {

  public static final MockableFn2<Integer, Integer, Integer> ADD = MockableFn2.function(
      Calculator.class, "add", int.class, int.class
  );
  public static final MockableFn0<String> VERSION = MockableFn0.function(
      Calculator.class, "version"
  );

  public static int add(int a, int b) {
    return ADD.call(a, b, (x, y) -> x + y);
  }

  public static String version() {
    return VERSION.call(() -> "1.0");
  }

  public static int subtract(int a, int b) {
    return a - b;
  }
}
