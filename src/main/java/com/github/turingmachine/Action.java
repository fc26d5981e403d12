package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a rule does once triggered: its tasks, in order, then the next m-configuration.
 */
public final class Action {
  private final List<Task> tasks;
  private final String nextMConfiguration;

  public Action(final List<Task> tasks, final String nextMConfiguration) {
    this.tasks = Collections.unmodifiableList(new ArrayList<>(tasks));
    this.nextMConfiguration = Objects.requireNonNull(nextMConfiguration);
  }

  public List<Task> getTasks() {
    return tasks;
  }

  public String getNextMConfiguration() {
    return nextMConfiguration;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Action)) {
      return false;
    }
    Action other = (Action) o;
    return tasks.equals(other.tasks) && nextMConfiguration.equals(other.nextMConfiguration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tasks, nextMConfiguration);
  }

  @Override
  public String toString() {
    return "Action [tasks=" + tasks + ", nextMConfiguration=" + nextMConfiguration + "]";
  }
}
