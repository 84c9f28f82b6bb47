package com.zielonka.parity;

public enum Player {
  EVEN, ODD;

  public int id() {
    return switch (this) {
      case EVEN -> 0;
      case ODD -> 1;
    };
  }

  public Player flip() {
    return switch (this) {
      case EVEN -> ODD;
      case ODD -> EVEN;
    };
  }

  /** The player who wins a play in which {@code priority} is the highest priority seen infinitely often. */
  public static Player favoredBy(int priority) {
    return priority % 2 == 0 ? EVEN : ODD;
  }

  public static Player of(int id) {
    return switch (id) {
      case 0 -> EVEN;
      case 1 -> ODD;
      default -> throw new IllegalArgumentException("Invalid player id " + id);
    };
  }
}
