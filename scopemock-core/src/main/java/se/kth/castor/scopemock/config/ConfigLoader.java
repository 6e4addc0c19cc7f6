package se.kth.castor.scopemock.config;

import se.kth.castor.scopemock.MockException;
import se.kth.castor.scopemock.MockException.Type;
import se.kth.castor.scopemock.SlotScope;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Locates and reads the {@link ScopeMockConfig}.
 * <ol>
 *   <li>the file named by the {@value #CONFIG_PROPERTY} system property, or</li>
 *   <li>the classpath resource {@value #DEFAULT_RESOURCE}, or</li>
 *   <li>{@link ScopeMockConfig#defaults()}</li>
 * </ol>
 * The {@value #SCOPE_PROPERTY} system property then overrides the default scope.
 */
public class ConfigLoader {

  public static final String CONFIG_PROPERTY = "scopemock.config";
  public static final String SCOPE_PROPERTY = "scopemock.scope";
  public static final String DEFAULT_RESOURCE = "scopemock.json";

  private final Json json;
  private final Properties properties;
  private final ClassLoader classLoader;

  public ConfigLoader(Properties properties, ClassLoader classLoader) {
    this.json = new Json();
    this.properties = properties;
    this.classLoader = classLoader;
  }

  public static ConfigLoader forCurrentProcess() {
    return new ConfigLoader(System.getProperties(), ConfigLoader.class.getClassLoader());
  }

  public ScopeMockConfig load() {
    ScopeMockConfig config;
    String configPath = properties.getProperty(CONFIG_PROPERTY);
    if (configPath != null && !configPath.isBlank()) {
      config = fromFile(Path.of(configPath));
    } else {
      config = fromResource(DEFAULT_RESOURCE);
      if (config == null) {
        config = ScopeMockConfig.defaults();
      }
    }

    String scope = properties.getProperty(SCOPE_PROPERTY);
    if (scope != null && !scope.isBlank()) {
      config = config.withScope(parseScope(scope));
    }
    return config;
  }

  public ScopeMockConfig fromFile(Path path) {
    try {
      return requireContent(json.fromJson(Files.readString(path), ScopeMockConfig.class), path);
    } catch (IOException e) {
      throw new MockException(Type.INVALID_CONFIGURATION, path.toString(), e);
    }
  }

  /**
   * Reads a configuration from the classpath.
   *
   * @param name the resource name
   * @return the configuration or {@code null} if the resource does not exist
   */
  public ScopeMockConfig fromResource(String name) {
    try (InputStream input = classLoader.getResourceAsStream(name)) {
      if (input == null) {
        return null;
      }
      return requireContent(json.fromJson(input, ScopeMockConfig.class), name);
    } catch (IOException e) {
      throw new MockException(Type.INVALID_CONFIGURATION, name, e);
    }
  }

  private static ScopeMockConfig requireContent(ScopeMockConfig config, Object source) {
    // "null" is valid JSON but no configuration
    if (config == null) {
      throw new MockException(Type.INVALID_CONFIGURATION, source + " is empty");
    }
    return config;
  }

  private static SlotScope parseScope(String value) {
    try {
      return SlotScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new MockException(
          Type.INVALID_CONFIGURATION,
          SCOPE_PROPERTY + "=" + value + " is not one of THREAD, GLOBAL",
          e
      );
    }
  }
}
