package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.github.turingmachine.TuringMachineException.Code;

/**
 * The symbol part of a rule's config, reduced to a set of symbols and a presence flag.
 *
 * With presence set, the query matches exactly the listed symbols. Without it, the query matches
 * every symbol <b>not</b> listed. Turing's model has no such absence query, but his tables use
 * "any other symbol" all the time when defining m-functions, and storing it lets a table do the
 * same without enumerating the whole alphabet. An empty query is the absence of nothing, that is
 * a match-all.
 */
public final class SymbolQuery {
  public static final String NOT = "Not";
  public static final String BLANK = "None";
  public static final String ANY = "Any";

  private static final List<String> RESERVED =
      Arrays.asList(NOT, Tokenizer.OPEN_GROUP, Tokenizer.CLOSE_GROUP);

  private final List<String> symbols;
  private final boolean presence;

  public SymbolQuery(final List<String> symbols, final boolean presence) {
    this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
    this.presence = presence;
  }

  /**
   * Evaluates the symbol tokens of a config:
   *
   * <pre>
   * symbols ::= [["Not"] (id | "[" id {id} "]")]
   * </pre>
   */
  public static SymbolQuery evaluate(final List<String> tokens) throws RuleSyntaxException {
    if (tokens.isEmpty()) {
      return new SymbolQuery(Collections.<String>emptyList(), false);
    }
    if (NOT.equals(tokens.get(0))) {
      if (tokens.size() == 1) {
        throw new RuleSyntaxException(Code.MISSING_NOT_SYMBOLS, tokens);
      }
      return new SymbolQuery(requireNoReserved(group(tokens.subList(1, tokens.size()))), false);
    }
    return new SymbolQuery(requireNoReserved(group(tokens)), true);
  }

  public static SymbolQuery evaluate(final String... tokens) throws RuleSyntaxException {
    return evaluate(Arrays.asList(tokens));
  }

  private static List<String> group(final List<String> tokens) throws RuleSyntaxException {
    if (tokens.size() == 1) {
      return tokens;
    }
    if (tokens.size() == 2 || !Tokenizer.OPEN_GROUP.equals(tokens.get(0))
        || !Tokenizer.CLOSE_GROUP.equals(tokens.get(tokens.size() - 1))) {
      throw new RuleSyntaxException(Code.INVALID_GROUPING, tokens);
    }
    return tokens.subList(1, tokens.size() - 1);
  }

  /**
   * Rejects a parsed symbol group holding any of the reserved tokens.
   */
  static List<String> requireNoReserved(final List<String> symbols) throws RuleSyntaxException {
    for (final String symbol : symbols) {
      if (RESERVED.contains(symbol)) {
        throw new RuleSyntaxException(Code.INVALID_SYMBOL_USE, "'" + symbol + "' in " + symbols);
      }
    }
    return symbols;
  }

  public List<String> getSymbols() {
    return symbols;
  }

  public Set<String> getSymbolSet() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
  }

  public boolean isPresence() {
    return presence;
  }

  public boolean matches(final String symbol) {
    return presence == symbols.contains(symbol);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SymbolQuery)) {
      return false;
    }
    SymbolQuery other = (SymbolQuery) o;
    return presence == other.presence && symbols.equals(other.symbols);
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbols, presence);
  }

  @Override
  public String toString() {
    return "SymbolQuery [symbols=" + symbols + ", presence=" + presence + "]";
  }
}
