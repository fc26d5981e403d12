package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed rule: the m-configurations it applies to, its still unevaluated symbol query tokens
 * and its action. An m-configuration list holding only {@link Tokenizer#INDENT} means "same as
 * the previous rule".
 */
public final class Rule {
  private final List<String> mConfigurations;
  private final List<String> symbolTokens;
  private final Action action;

  Rule(final List<String> mConfigurations, final List<String> symbolTokens,
      final Action action) {
    this.mConfigurations = Collections.unmodifiableList(new ArrayList<>(mConfigurations));
    this.symbolTokens = Collections.unmodifiableList(new ArrayList<>(symbolTokens));
    this.action = action;
  }

  public List<String> getMConfigurations() {
    return mConfigurations;
  }

  public boolean reusesPreviousMConfigurations() {
    return mConfigurations.size() == 1 && Tokenizer.INDENT.equals(mConfigurations.get(0));
  }

  public List<String> getSymbolTokens() {
    return symbolTokens;
  }

  public List<Task> getTasks() {
    return action.getTasks();
  }

  public String getNextMConfiguration() {
    return action.getNextMConfiguration();
  }

  public Action getAction() {
    return action;
  }

  @Override
  public String toString() {
    return "Rule [mConfigurations=" + RuleSyntaxException.render(mConfigurations)
        + ", symbolTokens=" + symbolTokens + ", action=" + action + "]";
  }
}
