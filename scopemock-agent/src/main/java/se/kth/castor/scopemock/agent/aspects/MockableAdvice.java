package se.kth.castor.scopemock.agent.aspects;

import se.kth.castor.scopemock.OverrideRecord;
import se.kth.castor.scopemock.agent.MockDispatch;
import java.lang.reflect.Method;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner.Typing;

/**
 * Inlined into mockable methods with a return value. The original body is skipped whenever an
 * override is active; the exit advice then replaces the (default) return value with the result of
 * the override.
 */
public class MockableAdvice {

  @Advice.OnMethodEnter(skipOn = Advice.OnNonDefaultValue.class)
  public static OverrideRecord onEnter(@Advice.Origin Method method) {
    return MockDispatch.lookup(method);
  }

  @Advice.OnMethodExit
  public static void onExit(
      @Advice.Enter OverrideRecord record,
      @Advice.Origin Method method,
      @Advice.This(optional = true) Object receiver,
      @Advice.AllArguments Object[] arguments,
      @Advice.Return(readOnly = false, typing = Typing.DYNAMIC) Object returned
  ) throws Throwable {
    if (record != null) {
      returned = MockDispatch.invoke(record, method, receiver, arguments);
    }
  }
}
