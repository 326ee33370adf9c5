package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;

public final class EventFormat {
  private EventFormat() {}

  public static String formatEvent(EventType type, Patient patient) {
    if (patient == null) {
      return type.getLabel() + ": (no patient)";
    } else {
      return String.format("%s: PatientID=%d, Name=%s, Type=%s, Time=%d",
                           type.getLabel(), patient.getId(), patient.getName(), describeType(type, patient),
                           patient.getArrival().getEpochSecond());
    }
  }

  public static String formatCapacity(int total, int occupied) {
    return String.format("Bed Status: %d/%d beds occupied", occupied, total);
  }

  private static Object describeType(EventType type, Patient patient) {
    switch (type) {
      case ALLOCATION_REQUESTED:
      case ALLOCATED:
      case RELEASED:
        return patient.getCareUnit();
      default:
        return patient.getPriorityClass();
    }
  }
}
