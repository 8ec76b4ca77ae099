package io.intellixity.polydb.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Engine-agnostic filter tree: an {@link AtomicCondition} or an AND/OR {@link LogicalGroup}.
 * Immutable once constructed; adapters walk it per call.
 */
@JsonSerialize(using = WhereConditionJsonSerializer.class)
@JsonDeserialize(using = WhereConditionJsonDeserializer.class)
public interface WhereCondition {
  <R> R accept(WhereConditionVisitor<R> visitor);
}
