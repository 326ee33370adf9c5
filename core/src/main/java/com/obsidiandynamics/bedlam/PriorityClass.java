package com.obsidiandynamics.bedlam;

public enum PriorityClass {
  REGULAR(0),
  EMERGENCY(1);

  private final int rank;

  PriorityClass(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
