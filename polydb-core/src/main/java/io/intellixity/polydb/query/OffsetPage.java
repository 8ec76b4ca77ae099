package io.intellixity.polydb.query;

import io.intellixity.polydb.error.EngineException;

public record OffsetPage(int offset, int limit) {
  public OffsetPage {
    if (limit <= 0) throw EngineException.malformedInput("pageSize", "pageSize must be > 0");
    if (offset < 0) throw EngineException.malformedInput("pageOffset", "pageOffset must be >= 0");
  }

  public static OffsetPage of(int pageSize, int pageOffset) {
    return new OffsetPage(pageOffset, pageSize);
  }

  /** Exclusive upper bound of the page. */
  public long end() { return (long) offset + limit; }
}
