package com.github.turingmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.turingmachine.TuringMachineException.Code;

/**
 * Config and action parsers.
 *
 * <pre>
 * config  ::= mconfs symbols
 * mconfs  ::= " " | id | "[" id {id} "]"
 * action  ::= {task} id
 * task    ::= "L" | "R" | "N" | "E" | "P" id
 * </pre>
 *
 * Only the single id form of mconfs is implemented. A bracketed m-configuration list is rejected
 * rather than guessed at.
 */
public final class RuleParser {

  public static Rule parse(final RawRule rawRule) throws RuleSyntaxException {
    final List<String> config = rawRule.getConfig();
    final List<String> mConfigurations = parseMConfigurations(config);
    final List<String> symbolTokens = config.subList(1, config.size());
    return new Rule(mConfigurations, symbolTokens, parseAction(rawRule.getAction()));
  }

  static List<String> parseMConfigurations(final List<String> config)
      throws RuleSyntaxException {
    final String mConfiguration = config.get(0);
    if (Tokenizer.OPEN_GROUP.equals(mConfiguration)
        || Tokenizer.CLOSE_GROUP.equals(mConfiguration)) {
      throw new RuleSyntaxException(Code.UNSUPPORTED_MCONF_GROUP, config);
    }
    return Collections.singletonList(mConfiguration);
  }

  /**
   * The last token is the next m-configuration, everything before it is a task.
   */
  public static Action parseAction(final List<String> action) throws RuleSyntaxException {
    if (action.isEmpty()) {
      throw new RuleSyntaxException(Code.MISSING_ACTION, action);
    }
    final List<Task> tasks = new ArrayList<>(action.size() - 1);
    for (final String token : action.subList(0, action.size() - 1)) {
      try {
        tasks.add(Task.parse(token));
      } catch (RuleSyntaxException unknownTask) {
        throw new RuleSyntaxException(unknownTask.getCode(),
            "'" + token + "' in " + RuleSyntaxException.render(action));
      }
    }
    return new Action(tasks, action.get(action.size() - 1));
  }

  private RuleParser() {}
}
