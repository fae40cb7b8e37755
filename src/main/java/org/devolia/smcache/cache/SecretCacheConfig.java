package org.devolia.smcache.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable configuration of a {@link SecretCache}.
 *
 * <p>Recognized options:
 *
 * <pre>
 * max_cache_size=1024                    # secrets kept in the top-level LRU, 0 disables caching
 * exception_retry_delay_base=1000        # ms to wait after the first failed refresh
 * exception_retry_growth_factor=2        # multiplier per consecutive failure
 * exception_retry_delay_max=3600000      # upper bound for the retry wait in ms
 * default_version_stage=AWSCURRENT       # stage used when a caller passes none
 * secret_refresh_interval=3600           # seconds between metadata refreshes, at most 100 years
 * secret_cache_hook                      # optional SecretCacheHook (not settable from properties)
 * </pre>
 *
 * <p>Any other option name is rejected when the configuration is built.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SecretCacheConfig {

  private static final Logger logger = LoggerFactory.getLogger(SecretCacheConfig.class);

  // Option names
  public static final String MAX_CACHE_SIZE = "max_cache_size";
  public static final String EXCEPTION_RETRY_DELAY_BASE = "exception_retry_delay_base";
  public static final String EXCEPTION_RETRY_GROWTH_FACTOR = "exception_retry_growth_factor";
  public static final String EXCEPTION_RETRY_DELAY_MAX = "exception_retry_delay_max";
  public static final String DEFAULT_VERSION_STAGE = "default_version_stage";
  public static final String SECRET_REFRESH_INTERVAL = "secret_refresh_interval";
  public static final String SECRET_CACHE_HOOK = "secret_cache_hook";

  // Default values
  public static final int DEFAULT_MAX_CACHE_SIZE = 1024;
  public static final long DEFAULT_EXCEPTION_RETRY_DELAY_BASE_MS = 1000;
  public static final double DEFAULT_EXCEPTION_RETRY_GROWTH_FACTOR = 2;
  public static final long DEFAULT_EXCEPTION_RETRY_DELAY_MAX_MS = 3_600_000;
  public static final String DEFAULT_VERSION_STAGE_VALUE = "AWSCURRENT";
  public static final long DEFAULT_SECRET_REFRESH_INTERVAL_SECONDS = 3600;

  /** Upper bound for the refresh interval, one hundred years. */
  public static final long MAX_SECRET_REFRESH_INTERVAL_SECONDS = 3_153_600_000L;

  private final int maxCacheSize;
  private final long exceptionRetryDelayBase;
  private final double exceptionRetryGrowthFactor;
  private final long exceptionRetryDelayMax;
  private final String defaultVersionStage;
  private final long secretRefreshInterval;
  private final SecretCacheHook secretCacheHook;

  private SecretCacheConfig(Builder builder) {
    this.maxCacheSize = builder.maxCacheSize;
    this.exceptionRetryDelayBase = builder.exceptionRetryDelayBase;
    this.exceptionRetryGrowthFactor = builder.exceptionRetryGrowthFactor;
    this.exceptionRetryDelayMax = builder.exceptionRetryDelayMax;
    this.defaultVersionStage = builder.defaultVersionStage;
    this.secretRefreshInterval = builder.secretRefreshInterval;
    this.secretCacheHook = builder.secretCacheHook;
  }

  /**
   * Creates configuration with default values.
   *
   * @return default configuration
   */
  public static SecretCacheConfig defaultConfig() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a configuration from named options.
   *
   * <p>Numeric options accept any {@link Number} or a parseable string. Options that are absent
   * keep their defaults.
   *
   * @param options option names mapped to values
   * @return the validated configuration
   * @throws IllegalArgumentException on an unknown option name or an invalid value
   */
  public static SecretCacheConfig fromOptions(Map<String, ?> options) {
    Builder builder = builder();
    for (Map.Entry<String, ?> option : options.entrySet()) {
      String name = option.getKey();
      Object value = option.getValue();
      switch (name) {
        case MAX_CACHE_SIZE -> builder.maxCacheSize(toInt(name, value));
        case EXCEPTION_RETRY_DELAY_BASE -> builder.exceptionRetryDelayBase(toLong(name, value));
        case EXCEPTION_RETRY_GROWTH_FACTOR ->
            builder.exceptionRetryGrowthFactor(toDouble(name, value));
        case EXCEPTION_RETRY_DELAY_MAX -> builder.exceptionRetryDelayMax(toLong(name, value));
        case DEFAULT_VERSION_STAGE -> builder.defaultVersionStage(toText(name, value));
        case SECRET_REFRESH_INTERVAL -> builder.secretRefreshInterval(toLong(name, value));
        case SECRET_CACHE_HOOK -> builder.secretCacheHook(toHook(value));
        default ->
            throw new IllegalArgumentException("Unexpected configuration option '" + name + "'");
      }
    }
    return builder.build();
  }

  /**
   * Builds a configuration from string properties named after the options.
   *
   * @param properties the properties
   * @return the validated configuration
   * @throws IllegalArgumentException on an unknown property name or an invalid value
   */
  public static SecretCacheConfig fromProperties(Properties properties) {
    Map<String, Object> options = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      options.put(name, properties.getProperty(name).trim());
    }
    return fromOptions(options);
  }

  public int getMaxCacheSize() {
    return maxCacheSize;
  }

  /**
   * Gets the delay after the first failed refresh.
   *
   * @return base retry delay in milliseconds
   */
  public long getExceptionRetryDelayBase() {
    return exceptionRetryDelayBase;
  }

  public double getExceptionRetryGrowthFactor() {
    return exceptionRetryGrowthFactor;
  }

  /**
   * Gets the upper bound for the retry delay.
   *
   * @return max retry delay in milliseconds
   */
  public long getExceptionRetryDelayMax() {
    return exceptionRetryDelayMax;
  }

  public String getDefaultVersionStage() {
    return defaultVersionStage;
  }

  /**
   * Gets the nominal interval between metadata refreshes.
   *
   * @return refresh interval in seconds
   */
  public long getSecretRefreshInterval() {
    return secretRefreshInterval;
  }

  /**
   * Gets the storage hook.
   *
   * @return the hook, or null if none is configured
   */
  public SecretCacheHook getSecretCacheHook() {
    return secretCacheHook;
  }

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (maxCacheSize < 0) {
      throw new IllegalArgumentException("Max cache size cannot be negative: " + maxCacheSize);
    }

    if (exceptionRetryDelayBase < 1) {
      throw new IllegalArgumentException(
          "Exception retry delay base must be at least 1ms: " + exceptionRetryDelayBase);
    }

    if (Double.isNaN(exceptionRetryGrowthFactor) || exceptionRetryGrowthFactor < 1.0) {
      throw new IllegalArgumentException(
          "Exception retry growth factor must be at least 1: " + exceptionRetryGrowthFactor);
    }

    if (exceptionRetryDelayMax < exceptionRetryDelayBase) {
      throw new IllegalArgumentException(
          "Exception retry delay max ("
              + exceptionRetryDelayMax
              + "ms) cannot be lower than the base delay ("
              + exceptionRetryDelayBase
              + "ms)");
    }

    if (defaultVersionStage == null || defaultVersionStage.trim().isEmpty()) {
      throw new IllegalArgumentException("Default version stage cannot be null or empty");
    }

    if (secretRefreshInterval < 1) {
      throw new IllegalArgumentException(
          "Secret refresh interval must be positive: " + secretRefreshInterval);
    }

    if (secretRefreshInterval > MAX_SECRET_REFRESH_INTERVAL_SECONDS) {
      throw new IllegalArgumentException(
          "Secret refresh interval cannot exceed "
              + MAX_SECRET_REFRESH_INTERVAL_SECONDS
              + "s: "
              + secretRefreshInterval);
    }

    logger.debug("Secret cache configuration validation passed");
  }

  @Override
  public String toString() {
    return "SecretCacheConfig{"
        + "maxCacheSize="
        + maxCacheSize
        + ", exceptionRetryDelayBase="
        + exceptionRetryDelayBase
        + ", exceptionRetryGrowthFactor="
        + exceptionRetryGrowthFactor
        + ", exceptionRetryDelayMax="
        + exceptionRetryDelayMax
        + ", defaultVersionStage="
        + defaultVersionStage
        + ", secretRefreshInterval="
        + secretRefreshInterval
        + ", secretCacheHook="
        + (secretCacheHook != null ? secretCacheHook.getClass().getName() : "none")
        + "}";
  }

  private static int toInt(String name, Object value) {
    long number = toLong(name, value);
    if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
      throw new IllegalArgumentException("Option '" + name + "' is out of range: " + number);
    }
    return (int) number;
  }

  private static long toLong(String name, Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Option '" + name + "' must be an integer: " + text, e);
      }
    }
    throw new IllegalArgumentException("Option '" + name + "' must be an integer: " + value);
  }

  private static double toDouble(String name, Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Option '" + name + "' must be a number: " + text, e);
      }
    }
    throw new IllegalArgumentException("Option '" + name + "' must be a number: " + value);
  }

  private static String toText(String name, Object value) {
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException("Option '" + name + "' must be a string: " + value);
  }

  private static SecretCacheHook toHook(Object value) {
    if (value == null || value instanceof SecretCacheHook) {
      return (SecretCacheHook) value;
    }
    throw new IllegalArgumentException(
        "Option '" + SECRET_CACHE_HOOK + "' must be a SecretCacheHook: " + value.getClass());
  }

  /** Fluent builder; {@link #build()} validates the result. */
  public static final class Builder {

    private int maxCacheSize = DEFAULT_MAX_CACHE_SIZE;
    private long exceptionRetryDelayBase = DEFAULT_EXCEPTION_RETRY_DELAY_BASE_MS;
    private double exceptionRetryGrowthFactor = DEFAULT_EXCEPTION_RETRY_GROWTH_FACTOR;
    private long exceptionRetryDelayMax = DEFAULT_EXCEPTION_RETRY_DELAY_MAX_MS;
    private String defaultVersionStage = DEFAULT_VERSION_STAGE_VALUE;
    private long secretRefreshInterval = DEFAULT_SECRET_REFRESH_INTERVAL_SECONDS;
    private SecretCacheHook secretCacheHook;

    private Builder() {}

    public Builder maxCacheSize(int maxCacheSize) {
      this.maxCacheSize = maxCacheSize;
      return this;
    }

    public Builder exceptionRetryDelayBase(long millis) {
      this.exceptionRetryDelayBase = millis;
      return this;
    }

    public Builder exceptionRetryGrowthFactor(double growthFactor) {
      this.exceptionRetryGrowthFactor = growthFactor;
      return this;
    }

    public Builder exceptionRetryDelayMax(long millis) {
      this.exceptionRetryDelayMax = millis;
      return this;
    }

    public Builder defaultVersionStage(String versionStage) {
      this.defaultVersionStage = versionStage;
      return this;
    }

    public Builder secretRefreshInterval(long seconds) {
      this.secretRefreshInterval = seconds;
      return this;
    }

    public Builder secretCacheHook(SecretCacheHook hook) {
      this.secretCacheHook = hook;
      return this;
    }

    /**
     * Builds and validates the configuration.
     *
     * @return the immutable configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public SecretCacheConfig build() {
      SecretCacheConfig config = new SecretCacheConfig(this);
      config.validate();
      logger.debug("Secret cache configuration initialized - {}", config);
      return config;
    }
  }
}
