package io.intellixity.polydb.spi.exec;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.exec.DatabasePlugin;
import io.intellixity.polydb.model.ChatMessage;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.query.Operator;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.query.WhereConditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Template base for adapters.
 *
 * Responsibilities:
 * - Run every operation through {@link #run(String, String, Work)} so failures carry engine type,
 *   operation and subject, and driver exceptions are classified
 * - Explicit {@code UNSUPPORTED_OPERATION} defaults for graph, raw execution and chat
 * - Never-throwing {@link #isAvailable(PluginConfig)} on top of {@link #probe(PluginConfig)}
 */
public abstract class AbstractDatabasePlugin implements DatabasePlugin {
  private static final Logger log = LoggerFactory.getLogger(AbstractDatabasePlugin.class);

  private final DatabaseType type;

  protected AbstractDatabasePlugin(DatabaseType type) {
    this.type = Objects.requireNonNull(type, "type");
  }

  @FunctionalInterface
  protected interface Work<T> {
    T call() throws Exception;
  }

  @Override
  public final DatabaseType type() { return type; }

  /** Connectivity probe; any exception means unavailable. */
  protected abstract void probe(PluginConfig config) throws Exception;

  @Override
  public final boolean isAvailable(PluginConfig config) {
    try {
      probe(config);
      return true;
    } catch (Exception e) {
      log.debug("polydb.available type={} available=false error={}", type, e.toString());
      return false;
    }
  }

  @Override
  public List<GraphUnit> getGraph(PluginConfig config, String schema) {
    throw unsupported("getGraph");
  }

  @Override
  public RowsResult rawExecute(PluginConfig config, String query) {
    throw unsupported("rawExecute");
  }

  @Override
  public List<ChatMessage> chat(PluginConfig config, String schema, String previousConversation, String query) {
    throw unsupported("chat");
  }

  protected final EngineException unsupported(String operation) {
    return EngineException.unsupported(type, operation);
  }

  /** Rejects filters that use operators outside {@link #supportedOperators()}. */
  protected final void checkOperators(WhereCondition where) {
    Set<Operator> supported = supportedOperators();
    for (Operator op : WhereConditions.operators(where)) {
      if (!supported.contains(op)) {
        throw EngineException.malformedFilter(op.symbol(), "operator is not supported by " + type.id());
      }
    }
  }

  protected final <T> T run(String operation, String subject, Work<T> work) {
    long start = System.nanoTime();
    try {
      T out = work.call();
      if (log.isDebugEnabled()) {
        log.debug("polydb.op type={} op={} subject={} durationMs={} outcome=ok",
            type, operation, subject, (System.nanoTime() - start) / 1_000_000.0);
      }
      return out;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineException(ErrorKind.EXECUTION_FAILURE, type, operation, subject, "interrupted", e);
    } catch (Exception e) {
      EngineException ee = translate(operation, subject, e);
      if (log.isDebugEnabled()) {
        log.debug("polydb.op type={} op={} subject={} durationMs={} outcome={}",
            type, operation, subject, (System.nanoTime() - start) / 1_000_000.0, ee.kind());
      }
      throw ee;
    }
  }

  /**
   * Classifies a failure. Adapters override {@link #isConnectivityFailure(Exception)} to recognise
   * their driver's connection errors.
   */
  protected EngineException translate(String operation, String subject, Exception e) {
    if (e instanceof EngineException ee) return ee.withContext(type, operation);
    if (isConnectivityFailure(e)) return EngineException.unavailable(type, operation, e);
    if (e instanceof IllegalArgumentException) {
      return EngineException.malformedInput(subject, e.getMessage(), e).withContext(type, operation);
    }
    return EngineException.executionFailure(type, operation, subject, e);
  }

  protected boolean isConnectivityFailure(Exception e) {
    return e instanceof java.net.ConnectException || e instanceof java.net.UnknownHostException;
  }

  protected static String requireName(String value, String label) {
    if (value == null || value.isBlank()) throw EngineException.malformedInput(label, label + " is required");
    return value;
  }
}
