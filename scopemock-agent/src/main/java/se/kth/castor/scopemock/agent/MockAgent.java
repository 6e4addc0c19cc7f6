package se.kth.castor.scopemock.agent;

import static net.bytebuddy.matcher.ElementMatchers.declaresMethod;
import static net.bytebuddy.matcher.ElementMatchers.isAbstract;
import static net.bytebuddy.matcher.ElementMatchers.isAnnotatedWith;
import static net.bytebuddy.matcher.ElementMatchers.isBridge;
import static net.bytebuddy.matcher.ElementMatchers.isDeclaredBy;
import static net.bytebuddy.matcher.ElementMatchers.isMethod;
import static net.bytebuddy.matcher.ElementMatchers.isNative;
import static net.bytebuddy.matcher.ElementMatchers.isSynthetic;
import static net.bytebuddy.matcher.ElementMatchers.nameStartsWith;
import static net.bytebuddy.matcher.ElementMatchers.not;
import static net.bytebuddy.matcher.ElementMatchers.returns;

import se.kth.castor.scopemock.MockException;
import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.Mockable;
import se.kth.castor.scopemock.agent.aspects.MockableAdvice;
import se.kth.castor.scopemock.agent.aspects.VoidMockableAdvice;
import java.lang.instrument.Instrumentation;
import net.bytebuddy.agent.ByteBuddyAgent;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.agent.builder.AgentBuilder.Listener;
import net.bytebuddy.agent.builder.AgentBuilder.RedefinitionStrategy;
import net.bytebuddy.agent.builder.AgentBuilder.Transformer.ForAdvice;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.matcher.ElementMatcher.Junction;
import net.bytebuddy.matcher.ElementMatchers;
import net.bytebuddy.utility.JavaModule;

/**
 * Rewrites every {@link Mockable} method so it consults its slot in the global registry before
 * running the original body.
 * <p>
 * Either start the JVM with {@code -javaagent:scopemock-agent.jar[=package,...]} or call
 * {@link #install()} before the first mocked call, e.g. from a {@code @BeforeAll} method. Classes
 * that are already loaded are retransformed.
 */
public class MockAgent {

  private static boolean installed;

  public static void premain(String arguments, Instrumentation instrumentation) {
    install(AgentOptions.parse(arguments), instrumentation);
  }

  public static void agentmain(String arguments, Instrumentation instrumentation) {
    install(AgentOptions.parse(arguments), instrumentation);
  }

  /**
   * Attaches the agent to the running JVM. Package restrictions are read from the
   * {@value AgentOptions#PACKAGES_PROPERTY} system property. Repeated calls have no effect.
   *
   * @throws MockException of type {@link Type#AGENT_UNAVAILABLE} if the JVM refuses the attach
   */
  public static synchronized void install() {
    if (installed) {
      return;
    }
    Instrumentation instrumentation;
    try {
      instrumentation = ByteBuddyAgent.install();
    } catch (IllegalStateException e) {
      throw new MockException(Type.AGENT_UNAVAILABLE, "could not attach to the running JVM", e);
    }
    String packages = System.getProperty(AgentOptions.PACKAGES_PROPERTY);
    install(AgentOptions.parse(packages), instrumentation);
  }

  public static synchronized boolean isInstalled() {
    return installed;
  }

  static synchronized void install(AgentOptions options, Instrumentation instrumentation) {
    if (installed) {
      return;
    }

    Junction<TypeDescription> mockableTypes = ElementMatchers.<TypeDescription>isAnnotatedWith(
        Mockable.class
    ).or(declaresMethod(isAnnotatedWith(Mockable.class)));

    // put the cheap restrictions first
    Junction<TypeDescription> typesToInstrument = not(isSynthetic())
        .and(not(nameStartsWith("net.bytebuddy.")))
        .and(options.typeMatcher())
        .and(mockableTypes);

    new AgentBuilder.Default()
        // transformation errors are swallowed otherwise
        .with(new LoggingListener())
        // loaded types are retransformed, which allows no schema changes
        .disableClassFormatChanges()
        .with(RedefinitionStrategy.RETRANSFORMATION)
        .type(typesToInstrument)
        .transform(
            new ForAdvice()
                .include(MockAgent.class.getClassLoader())
                .advice(
                    mockableMethods().and(not(returns(void.class))),
                    MockableAdvice.class.getName()
                )
                .advice(
                    mockableMethods().and(returns(void.class)),
                    VoidMockableAdvice.class.getName()
                )
        )
        .installOn(instrumentation);

    installed = true;
  }

  private static Junction<MethodDescription> mockableMethods() {
    return isMethod()
        .and(not(isAbstract()))
        .and(not(isNative()))
        .and(not(isSynthetic()))
        .and(not(isBridge()))
        .and(
            ElementMatchers.<MethodDescription>isAnnotatedWith(Mockable.class)
                .or(isDeclaredBy(isAnnotatedWith(Mockable.class)))
        );
  }

  @SuppressWarnings("NullableProblems")
  private static class LoggingListener implements Listener {

    @Override
    public void onDiscovery(String typeName, ClassLoader classLoader, JavaModule module,
        boolean loaded) {
    }

    @Override
    public void onTransformation(TypeDescription typeDescription, ClassLoader classLoader,
        JavaModule module, boolean loaded, DynamicType dynamicType) {
    }

    @Override
    public void onIgnored(TypeDescription typeDescription, ClassLoader classLoader,
        JavaModule module, boolean loaded) {
    }

    @Override
    public void onError(String typeName, ClassLoader classLoader, JavaModule module,
        boolean loaded, Throwable throwable) {
      System.err.println("MockAgent.onError");
      System.err.println(
          "\033[31m  typeName = " + typeName + ", classLoader = " + classLoader + ", module = "
          + module
          + ", loaded = " + loaded + ", throwable = " + throwable
          + "\033[0m");
    }

    @Override
    public void onComplete(String typeName, ClassLoader classLoader, JavaModule module,
        boolean loaded) {
    }
  }
}
