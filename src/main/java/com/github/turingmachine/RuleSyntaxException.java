package com.github.turingmachine;

import java.util.List;

/**
 * Raised while compiling rule source. Always fatal to machine construction.
 */
public final class RuleSyntaxException extends TuringMachineException {
  private static final long serialVersionUID = 1L;

  public RuleSyntaxException(final Code code) {
    super(code);
  }

  public RuleSyntaxException(final Code code, final String message) {
    super(code, message);
  }

  public RuleSyntaxException(final Code code, final List<String> tokens) {
    super(code, render(tokens));
  }

  // newline and indent markers are unreadable once printed, spell them out
  static String render(final List<String> tokens) {
    final StringBuilder builder = new StringBuilder("[");
    for (int iter = 0; iter < tokens.size(); iter++) {
      if (iter > 0) {
        builder.append(", ");
      }
      final String token = tokens.get(iter);
      if (Tokenizer.NEWLINE.equals(token)) {
        builder.append("<newline>");
      } else if (Tokenizer.INDENT.equals(token)) {
        builder.append("<indent>");
      } else {
        builder.append(token);
      }
    }
    return builder.append(']').toString();
  }
}
