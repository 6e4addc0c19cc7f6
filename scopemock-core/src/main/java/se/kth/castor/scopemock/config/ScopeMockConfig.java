package se.kth.castor.scopemock.config;

import se.kth.castor.scopemock.MockTarget;
import se.kth.castor.scopemock.ReleaseOrder;
import se.kth.castor.scopemock.SlotScope;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Settings of a {@link se.kth.castor.scopemock.MockRegistry}.
 *
 * @param scope the scope of every slot not matched by {@code scopeOverrides}
 * @param scopeOverrides scopes per class name prefix, the longest matching prefix wins
 * @param releaseOrder whether out of order guard releases are rejected
 * @param verbose whether installs and restores are traced to stderr
 */
public record ScopeMockConfig(
    SlotScope scope,
    Map<String, SlotScope> scopeOverrides,
    ReleaseOrder releaseOrder,
    boolean verbose
) {

  public ScopeMockConfig {
    scope = scope == null ? SlotScope.THREAD : scope;
    scopeOverrides = scopeOverrides == null ? Map.of() : Map.copyOf(scopeOverrides);
    releaseOrder = releaseOrder == null ? ReleaseOrder.ANY : releaseOrder;
  }

  public static ScopeMockConfig defaults() {
    return new ScopeMockConfig(null, null, null, false);
  }

  public ScopeMockConfig withScope(SlotScope scope) {
    return new ScopeMockConfig(scope, scopeOverrides, releaseOrder, verbose);
  }

  public SlotScope scopeFor(MockTarget target) {
    String className = target.declaringClassName();
    SlotScope best = scope;
    int bestLength = -1;
    for (Entry<String, SlotScope> entry : scopeOverrides.entrySet()) {
      String prefix = entry.getKey();
      if (!matchesPrefix(className, prefix) || prefix.length() <= bestLength) {
        continue;
      }
      best = entry.getValue();
      bestLength = prefix.length();
    }
    return best;
  }

  // "com.foo" matches "com.foo.Bar" and "com.foo", but not "com.foobar.Baz"
  private static boolean matchesPrefix(String className, String prefix) {
    if (!className.startsWith(prefix)) {
      return false;
    }
    if (className.length() == prefix.length()) {
      return true;
    }
    char next = className.charAt(prefix.length());
    return next == '.' || next == '$';
  }
}
