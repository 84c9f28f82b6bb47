package com.zielonka.parity;

/**
 * Signals a game that violates the structural requirements of a parity game, for example a state
 * without successors or an edge leading outside the game.
 */
public class InvalidGameException extends IllegalArgumentException {
  public InvalidGameException(String message) {
    super(message);
  }

  public InvalidGameException(String message, Throwable cause) {
    super(message, cause);
  }
}
