package com.obsidiandynamics.bedlam;

public final class IllegalLifecycleStateException extends IllegalStateException {
  public enum Reason {
    ALREADY_STARTED,
    SHUT_DOWN
  }

  private final Reason reason;

  public IllegalLifecycleStateException(Reason reason, String m) {
    super(m, null);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
