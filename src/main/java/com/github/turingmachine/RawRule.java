package com.github.turingmachine;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The (config, action) token blocks of one rule, before any parsing.
 */
public final class RawRule {
  private final List<String> config;
  private final List<String> action;

  public RawRule(final List<String> config, final List<String> action) {
    this.config = Collections.unmodifiableList(config);
    this.action = Collections.unmodifiableList(action);
  }

  public List<String> getConfig() {
    return config;
  }

  public List<String> getAction() {
    return action;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawRule)) {
      return false;
    }
    RawRule other = (RawRule) o;
    return config.equals(other.config) && action.equals(other.action);
  }

  @Override
  public int hashCode() {
    return Objects.hash(config, action);
  }

  @Override
  public String toString() {
    return "RawRule [config=" + RuleSyntaxException.render(config) + ", action="
        + RuleSyntaxException.render(action) + "]";
  }
}
