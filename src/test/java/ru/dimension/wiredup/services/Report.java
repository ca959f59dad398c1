package ru.dimension.wiredup.services;

import jakarta.inject.Inject;

/**
 * Two constructors of the same arity; the explicit one is chosen through {@code @Inject}.
 */
public class Report {
  public final String source;

  public Report(Database db) {
    this.source = "db";
  }

  @Inject
  public Report(RequestLogger logger) {
    this.source = "logger";
  }
}
