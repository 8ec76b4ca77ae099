package io.intellixity.polydb.spi.exec;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.model.PluginConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Acquire a connection, run one operation, release the connection.
 *
 * <p>Release happens on every exit path: success, operation error, runtime exception or interruption.
 * A connector failure surfaces as {@code UNAVAILABLE}; the operation's own exceptions propagate
 * unchanged with any release failure attached as suppressed.</p>
 */
public final class ConnectionScope {
  private static final Logger log = LoggerFactory.getLogger(ConnectionScope.class);

  private ConnectionScope() {}

  @FunctionalInterface
  public interface Connector<C> {
    C open(PluginConfig config) throws Exception;
  }

  @FunctionalInterface
  public interface Release<C> {
    void release(C connection) throws Exception;
  }

  @FunctionalInterface
  public interface Operation<C, T> {
    T apply(C connection) throws Exception;
  }

  public static <C extends AutoCloseable, T> T withConnection(PluginConfig config,
                                                              Connector<C> connector,
                                                              Operation<C, T> operation) throws Exception {
    return withConnection(config, connector, AutoCloseable::close, operation);
  }

  public static <C, T> T withConnection(PluginConfig config,
                                        Connector<C> connector,
                                        Release<C> release,
                                        Operation<C, T> operation) throws Exception {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(connector, "connector");
    Objects.requireNonNull(release, "release");
    Objects.requireNonNull(operation, "operation");

    C connection;
    try {
      connection = connector.open(config);
    } catch (EngineException e) {
      throw e;
    } catch (Exception e) {
      throw EngineException.unavailable(config.type(), null, e);
    }
    if (connection == null) {
      throw EngineException.unavailable(config.type(), null, new IllegalStateException("connector returned null"));
    }

    Throwable failure = null;
    try {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("operation cancelled before start");
      }
      return operation.apply(connection);
    } catch (Throwable t) {
      failure = t;
      throw t;
    } finally {
      try {
        release.release(connection);
      } catch (Exception e) {
        if (failure != null) {
          failure.addSuppressed(e);
        } else {
          log.warn("polydb.scope release_failed type={} error={}", config.type(), e.toString());
        }
      }
    }
  }
}
