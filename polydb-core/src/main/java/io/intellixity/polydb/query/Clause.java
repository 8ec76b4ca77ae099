package io.intellixity.polydb.query;

public enum Clause {
  AND("And"),
  OR("Or");

  private final String label;

  Clause(String label) { this.label = label; }

  public String label() { return label; }
}
