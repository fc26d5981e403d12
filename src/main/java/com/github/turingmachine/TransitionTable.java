package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.turingmachine.TuringMachineException.Code;

/**
 * Compiled rules of a machine, in two tiers.
 *
 * 1. exact rules, keyed by (m-configuration, symbol). The first rule written for a key wins,
 * later ones for the same key are ignored.<br>
 *
 * 2. fallback rules, from negated ("Not") and symbol-less configs, kept per m-configuration in
 * source order. They are only consulted when no exact rule exists, and the first one whose
 * excluded symbols don't include the scanned symbol wins.<br>
 *
 * A table is immutable once compiled, so machine copies share it.
 */
public final class TransitionTable {
  private static final Logger logger = LogManager.getLogger(TransitionTable.class.getSimpleName());

  private final Map<Trigger, Action> exactTable;
  private final Map<String, List<Fallback>> fallbackTable;
  private final String initialMConfiguration;

  private TransitionTable(final Map<Trigger, Action> exactTable,
      final Map<String, List<Fallback>> fallbackTable, final String initialMConfiguration) {
    this.exactTable = Collections.unmodifiableMap(exactTable);
    final Map<String, List<Fallback>> fallbacks = new LinkedHashMap<>();
    for (final Map.Entry<String, List<Fallback>> entry : fallbackTable.entrySet()) {
      fallbacks.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
    }
    this.fallbackTable = Collections.unmodifiableMap(fallbacks);
    this.initialMConfiguration = initialMConfiguration;
  }

  public static TransitionTable compile(final String source) throws RuleSyntaxException {
    return compile(source, LineFilter.DEFAULT_COMMENT_SYMBOL);
  }

  /**
   * Runs the whole pipeline: line filter, tokenizer, rule splitter, config/action parsers and
   * the table builder.
   */
  public static TransitionTable compile(final String source, final String commentSymbol)
      throws RuleSyntaxException {
    final RuleSplitter splitter =
        new RuleSplitter(Tokenizer.tokenize(source, commentSymbol));
    final Builder builder = new Builder();
    while (splitter.hasNext()) {
      builder.add(RuleParser.parse(splitter.next()));
    }
    final TransitionTable table = builder.build();
    logger.info(String.format(
        "Compiled transition table with %d exact and %d fallback rules, initial m-configuration:%s",
        table.exactRuleCount(), table.fallbackRuleCount(), table.initialMConfiguration));
    return table;
  }

  /**
   * Resolves the action for the given pair. An empty result means the machine is locked.
   */
  public Optional<Action> lookup(final String mConfiguration, final String symbol) {
    final Action exact = exactTable.get(new Trigger(mConfiguration, symbol));
    if (exact != null) {
      return Optional.of(exact);
    }
    final List<Fallback> fallbacks = fallbackTable.get(mConfiguration);
    if (fallbacks != null) {
      for (final Fallback fallback : fallbacks) {
        if (!fallback.getExcludedSymbols().contains(symbol)) {
          return Optional.of(fallback.getAction());
        }
      }
    }
    return Optional.empty();
  }

  public Optional<String> getInitialMConfiguration() {
    return Optional.ofNullable(initialMConfiguration);
  }

  public Optional<Action> exactAction(final String mConfiguration, final String symbol) {
    return Optional.ofNullable(exactTable.get(new Trigger(mConfiguration, symbol)));
  }

  public List<Fallback> fallbacks(final String mConfiguration) {
    final List<Fallback> fallbacks = fallbackTable.get(mConfiguration);
    return fallbacks == null ? Collections.<Fallback>emptyList() : fallbacks;
  }

  /**
   * Every m-configuration that has at least one rule of its own.
   */
  public Set<String> getMConfigurations() {
    final Set<String> mConfigurations = new LinkedHashSet<>();
    for (final Trigger trigger : exactTable.keySet()) {
      mConfigurations.add(trigger.getMConfiguration());
    }
    mConfigurations.addAll(fallbackTable.keySet());
    return Collections.unmodifiableSet(mConfigurations);
  }

  public int exactRuleCount() {
    return exactTable.size();
  }

  public int fallbackRuleCount() {
    int count = 0;
    for (final List<Fallback> fallbacks : fallbackTable.values()) {
      count += fallbacks.size();
    }
    return count;
  }

  @Override
  public String toString() {
    return "TransitionTable [initialMConfiguration=" + initialMConfiguration + ", exactRules="
        + exactTable.size() + ", fallbackRules=" + fallbackRuleCount() + "]";
  }

  /**
   * Accumulates parsed rules in source order.
   */
  static final class Builder {
    private final Map<Trigger, Action> exactTable = new HashMap<>();
    private final Map<String, List<Fallback>> fallbackTable = new LinkedHashMap<>();
    private List<String> lastMConfigurations;
    private String initialMConfiguration;

    Builder add(final Rule rule) throws RuleSyntaxException {
      List<String> mConfigurations = rule.getMConfigurations();
      if (rule.reusesPreviousMConfigurations()) {
        if (lastMConfigurations == null) {
          throw new RuleSyntaxException(Code.MISSING_FIRST_MCONF, rule.toString());
        }
        mConfigurations = lastMConfigurations;
      } else {
        if (initialMConfiguration == null) {
          initialMConfiguration = mConfigurations.get(0);
        }
        lastMConfigurations = mConfigurations;
      }

      final SymbolQuery query = SymbolQuery.evaluate(rule.getSymbolTokens());
      final Action action = rule.getAction();
      for (final String mConfiguration : mConfigurations) {
        if (query.isPresence()) {
          for (final String symbol : query.getSymbols()) {
            exactTable.putIfAbsent(new Trigger(mConfiguration, symbol), action);
          }
        } else {
          fallbackTable.computeIfAbsent(mConfiguration, key -> new ArrayList<>())
              .add(new Fallback(query.getSymbolSet(), action));
        }
      }
      return this;
    }

    TransitionTable build() {
      return new TransitionTable(exactTable, fallbackTable, initialMConfiguration);
    }
  }

  /**
   * Exact table key.
   */
  static final class Trigger {
    private final String mConfiguration;
    private final String symbol;

    Trigger(final String mConfiguration, final String symbol) {
      this.mConfiguration = mConfiguration;
      this.symbol = symbol;
    }

    String getMConfiguration() {
      return mConfiguration;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Trigger)) {
        return false;
      }
      Trigger other = (Trigger) o;
      return Objects.equals(mConfiguration, other.mConfiguration)
          && Objects.equals(symbol, other.symbol);
    }

    @Override
    public int hashCode() {
      return Objects.hash(mConfiguration, symbol);
    }

    @Override
    public String toString() {
      return "(" + mConfiguration + ", " + symbol + ")";
    }
  }

  /**
   * A negated rule: fires for any symbol outside the excluded set.
   */
  public static final class Fallback {
    private final Set<String> excludedSymbols;
    private final Action action;

    Fallback(final Set<String> excludedSymbols, final Action action) {
      this.excludedSymbols = excludedSymbols;
      this.action = action;
    }

    public Set<String> getExcludedSymbols() {
      return excludedSymbols;
    }

    public Action getAction() {
      return action;
    }

    @Override
    public String toString() {
      return "Fallback [excludedSymbols=" + excludedSymbols + ", action=" + action + "]";
    }
  }
}
