package se.kth.castor.scopemock.agent;

import static net.bytebuddy.matcher.ElementMatchers.any;
import static net.bytebuddy.matcher.ElementMatchers.nameStartsWith;
import static net.bytebuddy.matcher.ElementMatchers.none;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher.Junction;

/**
 * Options of the agent, passed as {@code -javaagent:scopemock-agent.jar=com.example,org.acme}.
 *
 * @param packagesToInstrument package prefixes of the types to examine, all types if empty
 */
public record AgentOptions(Set<String> packagesToInstrument) {

  public static final String PACKAGES_PROPERTY = "scopemock.agent.packages";

  public AgentOptions {
    packagesToInstrument = Set.copyOf(packagesToInstrument);
  }

  public static AgentOptions parse(String arguments) {
    if (arguments == null || arguments.isBlank()) {
      return new AgentOptions(Set.of());
    }
    return new AgentOptions(
        Arrays.stream(arguments.split(","))
            .map(String::trim)
            .filter(it -> !it.isEmpty())
            .collect(Collectors.toSet())
    );
  }

  public Junction<TypeDescription> typeMatcher() {
    if (packagesToInstrument.isEmpty()) {
      return any();
    }
    return packagesToInstrument.stream()
        .reduce(
            none(),
            (Junction<TypeDescription> acc, String next) -> acc.or(nameStartsWith(next)),
            Junction::or
        );
  }
}
