package se.kth.castor.scopemock.agent.aspects;

import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.agent.MockDispatch;
import java.lang.reflect.Method;
import net.bytebuddy.asm.Advice;

/**
 * {@link MockableAdvice} for void methods, which have no return value to replace.
 */
public class VoidMockableAdvice {

  @Advice.OnMethodEnter(skipOn = Advice.OnNonDefaultValue.class)
  public static OverrideRecord onEnter(@Advice.Origin Method method) {
    return MockDispatch.lookup(method);
  }

  @Advice.OnMethodExit
  public static void onExit(
      @Advice.Enter OverrideRecord record,
      @Advice.Origin Method method,
      @Advice.This(optional = true) Object receiver,
      @Advice.AllArguments Object[] arguments
  ) throws Throwable {
    if (record != null) {
      MockDispatch.invoke(record, method, receiver, arguments);
    }
  }
}
