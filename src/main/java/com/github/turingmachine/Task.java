package com.github.turingmachine;

import java.util.Objects;

import com.github.turingmachine.TuringMachineException.Code;

/**
 * One atomic effect of a step. Tokens are "L", "R", "N", "E" and "P" glued to the symbol to
 * print, e.g. "P1" or "PNone" (which erases).
 */
public final class Task {
  public static final Task LEFT = new Task(Kind.LEFT, null);
  public static final Task RIGHT = new Task(Kind.RIGHT, null);
  public static final Task NOOP = new Task(Kind.NOOP, null);
  public static final Task ERASE = new Task(Kind.ERASE, null);

  private final Kind kind;
  private final String symbol;

  private Task(final Kind kind, final String symbol) {
    this.kind = kind;
    this.symbol = symbol;
  }

  public static Task print(final String symbol) {
    return new Task(Kind.PRINT, Objects.requireNonNull(symbol));
  }

  public static Task parse(final String token) throws RuleSyntaxException {
    switch (token) {
      case "L":
        return LEFT;
      case "R":
        return RIGHT;
      case "N":
        return NOOP;
      case "E":
        return ERASE;
      default:
        if (token.length() > 1 && token.startsWith("P")) {
          return print(token.substring(1));
        }
        throw new RuleSyntaxException(Code.UNKNOWN_TASK, "'" + token + "'");
    }
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Symbol to print, null for every kind but {@link Kind#PRINT}.
   */
  public String getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Task)) {
      return false;
    }
    Task other = (Task) o;
    return kind == other.kind && Objects.equals(symbol, other.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, symbol);
  }

  @Override
  public String toString() {
    return kind == Kind.PRINT ? "P" + symbol : kind.token;
  }

  public static enum Kind {
    LEFT("L"), RIGHT("R"), NOOP("N"), ERASE("E"), PRINT("P");

    private final String token;

    private Kind(final String token) {
      this.token = token;
    }

    public String getToken() {
      return token;
    }
  }
}
