package io.castbus.event;

/**
 * Grouping of the catalog event types, used for filtering and reporting.
 */
public enum EventCategory {
  CHARACTER,
  RELATIONSHIP,
  DEVELOPMENT,
  ANALYSIS
}
