package io.intellixity.polydb.model;

import java.util.List;
import java.util.Objects;

/** Table, collection, index or key namespace plus its ordered attribute records. */
public record StorageUnit(String name, List<Record> attributes) {
  public StorageUnit {
    Objects.requireNonNull(name, "name");
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public String attribute(String key) {
    for (Record r : attributes) {
      if (r.key().equals(key)) return r.value();
    }
    return null;
  }
}
