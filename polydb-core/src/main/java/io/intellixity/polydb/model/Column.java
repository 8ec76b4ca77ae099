package io.intellixity.polydb.model;

import java.util.Objects;

public record Column(String name, String type) {
  public Column {
    Objects.requireNonNull(name, "name");
  }
}
