package ru.dimension.wiredup.services;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class Database implements AutoCloseable {
  private static final AtomicInteger SEQ = new AtomicInteger();

  public final int id = SEQ.incrementAndGet();
  private final List<String> queries = new ArrayList<>();
  private int closeCount;

  public List<String> query(String sql) {
    if (closeCount > 0) throw new IllegalStateException("Database " + id + " is closed");
    queries.add(sql);
    return List.of();
  }

  public List<String> queries() {
    return List.copyOf(queries);
  }

  @Override
  public void close() {
    closeCount++;
  }

  public boolean isClosed() {
    return closeCount > 0;
  }

  public int closeCount() {
    return closeCount;
  }
}
