package com.obsidiandynamics.bedlam.pool;

public final class BedSnapshot {
  private final int occupied;

  private final int totalCapacity;

  public BedSnapshot(int occupied, int totalCapacity) {
    this.occupied = occupied;
    this.totalCapacity = totalCapacity;
  }

  public int getOccupied() {
    return occupied;
  }

  public int getTotalCapacity() {
    return totalCapacity;
  }

  public int getVacant() {
    return totalCapacity - occupied;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (BedSnapshot) o;
    if (occupied != that.occupied) return false;
    return totalCapacity == that.totalCapacity;
  }

  @Override
  public int hashCode() {
    return 31 * occupied + totalCapacity;
  }

  @Override
  public String toString() {
    return BedSnapshot.class.getSimpleName() + "[occupied=" + occupied + ", totalCapacity=" + totalCapacity + ']';
  }
}
