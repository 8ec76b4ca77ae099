package io.intellixity.polydb.exec;

import io.intellixity.polydb.model.ChatMessage;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.Operator;
import io.intellixity.polydb.query.WhereCondition;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability contract implemented by every engine adapter.
 *
 * <p>Every operation is a self-contained unit of work: the adapter opens its own connection from the
 * given {@link PluginConfig}, runs the operation and releases the connection before returning.
 * Failures surface as {@link io.intellixity.polydb.error.EngineException}; operations an engine cannot
 * meaningfully perform raise {@code UNSUPPORTED_OPERATION} instead of returning an empty result.</p>
 */
public interface DatabasePlugin {
  DatabaseType type();

  /** Lightweight connectivity probe. Never throws. */
  boolean isAvailable(PluginConfig config);

  List<String> getDatabases(PluginConfig config);

  List<String> getAllSchemas(PluginConfig config);

  List<StorageUnit> getStorageUnits(PluginConfig config, String schema);

  /**
   * Filtered, offset-paginated rows of one storage unit.
   *
   * @param where optional filter; {@code null} returns every row
   */
  RowsResult getRows(PluginConfig config, String schema, String storageUnit, WhereCondition where,
                     int pageSize, int pageOffset);

  boolean addStorageUnit(PluginConfig config, String schema, String storageUnit, List<Record> fields);

  /** Updates one row: sets {@code updatedColumns} from {@code values}, addressing the row by the rest. */
  boolean updateStorageUnit(PluginConfig config, String schema, String storageUnit,
                            Map<String, String> values, List<String> updatedColumns);

  boolean addRow(PluginConfig config, String schema, String storageUnit, List<Record> values);

  boolean deleteRow(PluginConfig config, String schema, String storageUnit, Map<String, String> values);

  List<GraphUnit> getGraph(PluginConfig config, String schema);

  RowsResult rawExecute(PluginConfig config, String query);

  List<ChatMessage> chat(PluginConfig config, String schema, String previousConversation, String query);

  /** Filter operators this engine can evaluate. */
  default Set<Operator> supportedOperators() {
    return EnumSet.allOf(Operator.class);
  }
}
