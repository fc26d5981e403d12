package com.github.turingmachine;

/**
 * Base exception thrown by this library. The code enum encapsulates the various error
 * conditions. Rule source problems are always reported as {@link RuleSyntaxException} and the
 * halting signal as {@link MachineLockedException}, so callers can catch the two kinds apart.
 */
public class TuringMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public TuringMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public TuringMachineException(final Code code, final String message) {
    super(code.getDescription() + ": " + message);
    this.code = code;
  }

  public TuringMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1. rule source
    INCOMPLETE_RULE("Incomplete rule"),
    // 2.
    MISSING_CONFIG("Incomplete rule (missing config)"),
    // 3.
    MISSING_ACTION("Incomplete rule (missing action)"),
    // 4.
    UNEXPECTED_END_OF_TOKENS("Incomplete rule (unexpected end of tokens)"),
    // 5.
    INVALID_GROUPING("Invalid grouping of symbols"),
    // 6.
    INVALID_SYMBOL_USE("Invalid use of a reserved symbol"),
    // 7.
    MISSING_NOT_SYMBOLS("Missing symbols for the 'Not' keyword"),
    // 8.
    MISSING_FIRST_MCONF("Missing m-configuration in the first rule"),
    // 9.
    UNSUPPORTED_MCONF_GROUP("Only a single m-configuration per rule is supported"),
    // 10.
    UNKNOWN_TASK("Unknown task"),
    // 11. runtime
    MACHINE_LOCKED("No rule found for the current configuration, the machine is locked"),
    // 12.
    INVALID_MACHINE_CONFIG("Turing machine configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
