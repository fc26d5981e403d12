package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.github.turingmachine.TuringMachineException.Code;

/**
 * Groups a token stream into {@link RawRule}s following
 *
 * <pre>
 * rule ::= config "->" action "\n"
 * </pre>
 *
 * Neither block may be empty. Unlike a plain iterator, {@link #hasNext()} and {@link #next()}
 * throw {@link RuleSyntaxException} as soon as a malformed rule is reached; after that the
 * splitter yields nothing more.
 */
public final class RuleSplitter {
  private final Iterator<String> tokens;
  private RawRule nextRule;
  private boolean failed;

  public RuleSplitter(final Iterator<String> tokens) {
    this.tokens = tokens;
  }

  public boolean hasNext() throws RuleSyntaxException {
    if (nextRule == null && !failed) {
      try {
        nextRule = split();
      } catch (RuleSyntaxException syntaxError) {
        failed = true;
        throw syntaxError;
      }
    }
    return nextRule != null;
  }

  public RawRule next() throws RuleSyntaxException {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final RawRule rule = nextRule;
    nextRule = null;
    return rule;
  }

  /**
   * Drains the splitter into a list.
   */
  public List<RawRule> toList() throws RuleSyntaxException {
    final List<RawRule> rules = new ArrayList<>();
    while (hasNext()) {
      rules.add(next());
    }
    return rules;
  }

  // reads tokens up to the end of the next complete rule, null at end of tokens
  private RawRule split() throws RuleSyntaxException {
    final List<String> config = new ArrayList<>();
    final List<String> action = new ArrayList<>();
    boolean inAction = false;
    while (tokens.hasNext()) {
      final String token = tokens.next();
      if (Tokenizer.ARROW.equals(token)) {
        inAction = true;
      } else if (Tokenizer.NEWLINE.equals(token)) {
        if (!action.isEmpty()) {
          if (config.isEmpty()) {
            throw new RuleSyntaxException(Code.MISSING_CONFIG, action);
          }
          return new RawRule(config, action);
        } else if (!config.isEmpty()) {
          throw new RuleSyntaxException(Code.MISSING_ACTION, config);
        } else if (inAction) {
          throw new RuleSyntaxException(Code.INCOMPLETE_RULE);
        }
      } else if (inAction) {
        action.add(token);
      } else {
        config.add(token);
      }
    }
    if (!config.isEmpty() || inAction) {
      final List<String> leftover = new ArrayList<>(config);
      leftover.addAll(action);
      throw new RuleSyntaxException(Code.UNEXPECTED_END_OF_TOKENS, leftover);
    }
    return null;
  }

}
