package se.kth.castor.scopemock;

import se.kth.castor.scopemock.config.ConfigLoader;
import se.kth.castor.scopemock.config.ScopeMockConfig;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link OverrideSlot} per {@link MockTarget}. Slots are created on first use and live as
 * long as the registry; no two targets ever share a slot.
 */
public class MockRegistry {

  private final ScopeMockConfig config;
  private final Map<MockTarget, OverrideSlot> slots;

  public MockRegistry(ScopeMockConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.slots = new ConcurrentHashMap<>();
  }

  /**
   * {@return the process wide registry, configured by {@link ConfigLoader#forCurrentProcess()}}
   */
  public static MockRegistry global() {
    return GlobalHolder.INSTANCE;
  }

  public OverrideSlot slotFor(MockTarget target) {
    return slots.computeIfAbsent(
        target,
        it -> new OverrideSlot(it, config.scopeFor(it), config.releaseOrder(), config.verbose())
    );
  }

  public MockGuard install(MockTarget target, OverrideRecord record) {
    return slotFor(target).override(record);
  }

  public Optional<OverrideRecord> peek(MockTarget target) {
    return slotFor(target).peek();
  }

  public boolean isMocked(MockTarget target) {
    return peek(target).isPresent();
  }

  public ScopeMockConfig config() {
    return config;
  }

  private static class GlobalHolder {

    private static final MockRegistry INSTANCE = new MockRegistry(
        ConfigLoader.forCurrentProcess().load()
    );
  }
}
