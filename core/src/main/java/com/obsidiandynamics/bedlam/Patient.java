package com.obsidiandynamics.bedlam;

import java.time.*;
import java.util.*;

public final class Patient {
  public static final int MIN_SEVERITY = 1;

  public static final int MAX_SEVERITY = 10;

  // higher priority class first, then earlier arrival, then lower id; ids are unique so the order is total
  public static final Comparator<Patient> ADMISSION_ORDER =
      Comparator.comparingInt((Patient patient) -> patient.priorityClass.rank()).reversed()
          .thenComparing(Patient::getArrival)
          .thenComparingLong(Patient::getId);

  private final long id;

  private final String name;

  private final PriorityClass priorityClass;

  private final CareUnit careUnit;

  private final int severity;

  private final Instant arrival;

  public Patient(long id, String name, PriorityClass priorityClass, CareUnit careUnit, int severity, Instant arrival) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.priorityClass = Objects.requireNonNull(priorityClass, "priorityClass");
    this.careUnit = Objects.requireNonNull(careUnit, "careUnit");
    this.severity = severity;
    this.arrival = Objects.requireNonNull(arrival, "arrival");
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public PriorityClass getPriorityClass() {
    return priorityClass;
  }

  public CareUnit getCareUnit() {
    return careUnit;
  }

  public int getSeverity() {
    return severity;
  }

  public Instant getArrival() {
    return arrival;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Patient) o;
    if (id != that.id) return false;
    if (severity != that.severity) return false;
    if (!Objects.equals(name, that.name)) return false;
    if (priorityClass != that.priorityClass) return false;
    if (careUnit != that.careUnit) return false;
    return Objects.equals(arrival, that.arrival);
  }

  @Override
  public int hashCode() {
    int result = (int) (id ^ (id >>> 32));
    result = 31 * result + Objects.hashCode(name);
    result = 31 * result + Objects.hashCode(priorityClass);
    result = 31 * result + Objects.hashCode(careUnit);
    result = 31 * result + severity;
    result = 31 * result + Objects.hashCode(arrival);
    return result;
  }

  @Override
  public String toString() {
    return Patient.class.getSimpleName() + "[id=" + id +
        ", name=" + name +
        ", priorityClass=" + priorityClass +
        ", careUnit=" + careUnit +
        ", severity=" + severity +
        ", arrival=" + arrival + ']';
  }
}
