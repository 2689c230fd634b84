package io.tether.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Properties;

import io.tether.Connections;
import io.tether.event.ChannelListener;
import io.tether.event.ConnectionListener;
import io.tether.event.ConsumerListener;
import io.tether.internal.util.Assert;
import io.tether.util.Duration;

/**
 * Tether configuration. Changes are reflected in the connections created with this
 * configuration.
 * 
 * @author Tether Authors
 */
public class Config {
  public static final String AUTOMATIC_RECOVERY_ENABLED = "automatic-recovery-enabled";
  public static final String TOPOLOGY_RECOVERY_ENABLED = "automatic-topology-recovery-enabled";
  public static final String RECOVERY_INTERVAL = "recovery-interval";
  public static final String RECOVERY_MAX_ATTEMPTS = "recovery-max-attempts";
  public static final String RECOVERY_MAX_DURATION = "recovery-max-duration";

  private volatile boolean automaticRecovery = true;
  private volatile boolean topologyRecovery = true;
  private volatile RecoveryPolicy recoveryPolicy = RecoveryPolicies.recoverAlways();
  private volatile Collection<ConnectionListener> connectionListeners = Collections.emptyList();
  private volatile Collection<ChannelListener> channelListeners = Collections.emptyList();
  private volatile Collection<ConsumerListener> consumerListeners = Collections.emptyList();

  /**
   * Returns a new Config initialized from the {@code properties}. Recognized keys are
   * {@value #AUTOMATIC_RECOVERY_ENABLED}, {@value #TOPOLOGY_RECOVERY_ENABLED},
   * {@value #RECOVERY_INTERVAL}, {@value #RECOVERY_MAX_ATTEMPTS} and
   * {@value #RECOVERY_MAX_DURATION}. Durations are parsed with {@link Duration#of(String)}.
   * Other keys are ignored.
   * 
   * @throws IllegalArgumentException if a recognized key has a malformed value
   */
  public static Config fromProperties(Properties properties) {
    Assert.notNull(properties, "properties");
    Config config = new Config();
    String value = properties.getProperty(AUTOMATIC_RECOVERY_ENABLED);
    if (value != null)
      config.withAutomaticRecovery(parseBoolean(AUTOMATIC_RECOVERY_ENABLED, value));
    value = properties.getProperty(TOPOLOGY_RECOVERY_ENABLED);
    if (value != null)
      config.withTopologyRecovery(parseBoolean(TOPOLOGY_RECOVERY_ENABLED, value));

    RecoveryPolicy policy = RecoveryPolicies.recoverAlways();
    value = properties.getProperty(RECOVERY_INTERVAL);
    if (value != null)
      policy.withInterval(Duration.of(value));
    value = properties.getProperty(RECOVERY_MAX_ATTEMPTS);
    if (value != null)
      try {
        policy.withMaxAttempts(Integer.parseInt(value.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + RECOVERY_MAX_ATTEMPTS + ": " + value, e);
      }
    value = properties.getProperty(RECOVERY_MAX_DURATION);
    if (value != null)
      policy.withMaxDuration(Duration.of(value));
    return config.withRecoveryPolicy(policy);
  }

  public Collection<ChannelListener> getChannelListeners() {
    return channelListeners;
  }

  public Collection<ConnectionListener> getConnectionListeners() {
    return connectionListeners;
  }

  public Collection<ConsumerListener> getConsumerListeners() {
    return consumerListeners;
  }

  /**
   * Returns the policy that governs reconnect attempts after an unexpected connection closure.
   * 
   * @see #withRecoveryPolicy(RecoveryPolicy)
   */
  public RecoveryPolicy getRecoveryPolicy() {
    return recoveryPolicy;
  }

  /**
   * Returns whether lost connections are automatically re-established. Defaults to true.
   */
  public boolean isAutomaticRecoveryEnabled() {
    return automaticRecovery && recoveryPolicy.allowsAttempts();
  }

  /**
   * Returns whether exchanges, queues, bindings and consumers are recorded and replayed when a
   * connection is recovered. Defaults to true.
   */
  public boolean isTopologyRecoveryEnabled() {
    return topologyRecovery;
  }

  /**
   * Sets whether lost connections are automatically re-established. When disabled, the loss of a
   * connection is terminal and is reported via
   * {@link ConnectionListener#onConnectionLost(io.tether.RecoverableConnection, Throwable)}.
   */
  public Config withAutomaticRecovery(boolean enabled) {
    automaticRecovery = enabled;
    return this;
  }

  public Config withChannelListeners(ChannelListener... channelListeners) {
    this.channelListeners = Arrays.asList(channelListeners);
    return this;
  }

  public Config withConnectionListeners(ConnectionListener... connectionListeners) {
    this.connectionListeners = Arrays.asList(connectionListeners);
    return this;
  }

  public Config withConsumerListeners(ConsumerListener... consumerListeners) {
    this.consumerListeners = Arrays.asList(consumerListeners);
    return this;
  }

  /**
   * Sets the policy to use for re-establishing a connection after an unexpected closure.
   * 
   * @throws NullPointerException if {@code recoveryPolicy} is null
   * @see Connections#create(io.tether.ConnectionOptions, Config)
   */
  public Config withRecoveryPolicy(RecoveryPolicy recoveryPolicy) {
    this.recoveryPolicy = Assert.notNull(recoveryPolicy, "recoveryPolicy");
    return this;
  }

  /**
   * Sets whether exchanges, queues, bindings and consumers are recorded and replayed when a
   * connection is recovered. When disabled, recovered channels are re-opened empty and the
   * application is responsible for declaring everything again.
   */
  public Config withTopologyRecovery(boolean enabled) {
    topologyRecovery = enabled;
    return this;
  }

  private static boolean parseBoolean(String key, String value) {
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed))
      return true;
    if ("false".equalsIgnoreCase(trimmed))
      return false;
    throw new IllegalArgumentException("Invalid " + key + ": " + value);
  }
}
