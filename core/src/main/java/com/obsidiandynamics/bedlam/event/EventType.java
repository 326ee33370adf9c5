package com.obsidiandynamics.bedlam.event;

public enum EventType {
  CHECK_IN("Check-In"),
  ADMITTED("Admitted"),
  DISCHARGED("Discharged"),
  ALLOCATION_REQUESTED("Allocation-Requested"),
  ALLOCATED("Allocated"),
  RELEASED("Released");

  private final String label;

  EventType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
