package com.evoila.influxql.compiler.core;

import com.evoila.influxql.compiler.model.dto.Comparator;
import com.evoila.influxql.compiler.model.dto.Condition;
import com.evoila.influxql.compiler.model.dto.GroupDirective;
import com.evoila.influxql.compiler.model.dto.QueryRequest;
import com.evoila.influxql.compiler.model.dto.QuotingMode;
import com.evoila.influxql.compiler.model.result.DirectiveViolation;
import com.evoila.influxql.compiler.model.result.InvalidComparator;
import com.evoila.influxql.compiler.model.result.InvalidGroupByDirective;
import com.evoila.influxql.compiler.utils.ValuePatternUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles the WHERE and GROUP BY clauses of a query.
 *
 * <p>Conditions on the {@code time} field are hoisted out of their groups into a single time pool
 * that is always AND-combined, because time ranges intersect rather than alternate. The remaining
 * conditions keep their AND-within-group, OR-across-groups structure:
 *
 * <pre>
 *   (time &gt; now() - 2d AND time &lt; now() - 1d) AND (host = 'a' OR region = 'eu')
 * </pre>
 *
 * <p>Validation is all-or-nothing per clause: a single invalid condition or directive fails the
 * clause, and the error lists every offending entry.
 */
@Slf4j
@RequiredArgsConstructor
public final class ClauseAssembler {

  static final String MISSING_TIME_CONDITION = "missing time condition in where statement";
  static final String INVALID_FILL_OPTION =
      "fill requires given opt: " + ValuePatternUtils.FILL_OPTIONS_DESCRIPTION;

  private static final String AND = " AND ";
  private static final String OR = " OR ";
  private static final String WHERE_KEYWORD = " WHERE ";
  private static final String GROUP_BY_KEYWORD = " GROUP BY ";

  private final ConditionRenderer conditionRenderer;
  private final ValueClassifier valueClassifier;

  /**
   * Conditions split into hoisted time conditions and the remaining groups.
   *
   * @param timeConditions All {@code time} conditions in request order
   * @param groups The request groups without their {@code time} conditions; may contain empty
   *     groups
   */
  public record TimePartition(List<Condition> timeConditions, List<List<Condition>> groups) {}

  // ============================================================================
  // TIME BOUNDS
  // ============================================================================

  /**
   * Turns {@code from} and {@code to} into condition groups placed ahead of the request's own
   * groups: {@code [time > from]} and {@code [time < to]}.
   *
   * @param request The request to desugar
   * @return All condition groups of the request including the time-bound groups
   */
  public List<List<Condition>> desugarTimeBounds(QueryRequest request) {
    List<List<Condition>> groups = new ArrayList<>();
    if (request.getFrom() != null) {
      groups.add(
          List.of(
              Condition.expression(
                  Condition.TIME_FIELD,
                  request.getFrom(),
                  Comparator.GREATER_THAN.getSymbol())));
    }
    if (request.getTo() != null) {
      groups.add(
          List.of(
              Condition.expression(
                  Condition.TIME_FIELD, request.getTo(), Comparator.LESS_THAN.getSymbol())));
    }
    groups.addAll(request.getConditions());
    return groups;
  }

  /** Separates the {@code time} conditions of all groups from the rest. */
  public TimePartition partition(List<List<Condition>> groups) {
    List<Condition> timeConditions = new ArrayList<>();
    List<List<Condition>> remaining = new ArrayList<>();

    for (List<Condition> group : groups) {
      List<Condition> kept = new ArrayList<>();
      for (Condition condition : group) {
        if (condition.isTimeCondition()) {
          timeConditions.add(condition);
        } else {
          kept.add(condition);
        }
      }
      remaining.add(kept);
    }

    log.debug(
        "ClauseAssembler: Hoisted {} time condition(s) out of {} group(s)",
        timeConditions.size(),
        groups.size());
    return new TimePartition(timeConditions, remaining);
  }

  // ============================================================================
  // WHERE
  // ============================================================================

  /**
   * Renders the WHERE segment for the given (already desugared) condition groups.
   *
   * @param groups Condition groups, OR-combined
   * @return " WHERE ..." text, an empty segment if there is nothing to filter on, or an {@link
   *     InvalidComparator} error listing every condition with an unsupported comparator
   */
  public ClauseResult renderWhere(List<List<Condition>> groups) {
    TimePartition partition = partition(groups);
    List<Condition> invalid = new ArrayList<>();

    List<String> groupTexts = new ArrayList<>();
    for (List<Condition> group : partition.groups()) {
      String groupText = renderAndJoined(group, invalid);
      if (!groupText.isEmpty()) {
        groupTexts.add(groupText);
      }
    }
    String nonTimeText = String.join(OR, groupTexts);
    String timeText = renderAndJoined(partition.timeConditions(), invalid);

    if (!invalid.isEmpty()) {
      log.warn("ClauseAssembler: {} condition(s) with invalid comparator", invalid.size());
      return ClauseResult.failed(new InvalidComparator(invalid));
    }

    String clause = joinTimeWithConditions(timeText, nonTimeText);
    if (clause.isEmpty()) {
      return ClauseResult.empty();
    }
    log.debug("ClauseAssembler: Built WHERE clause '{}'", clause);
    return ClauseResult.of(WHERE_KEYWORD + clause);
  }

  private String renderAndJoined(List<Condition> conditions, List<Condition> invalid) {
    List<String> rendered = new ArrayList<>();
    for (Condition condition : conditions) {
      Optional<String> text = conditionRenderer.render(condition);
      if (text.isPresent()) {
        rendered.add(text.get());
      } else {
        invalid.add(condition);
      }
    }
    return String.join(AND, rendered);
  }

  private static String joinTimeWithConditions(String timeText, String nonTimeText) {
    if (timeText.isEmpty()) {
      return nonTimeText;
    }
    if (nonTimeText.isEmpty()) {
      return timeText;
    }
    return "(" + timeText + ")" + AND + "(" + nonTimeText + ")";
  }

  // ============================================================================
  // GROUP BY
  // ============================================================================

  /**
   * Renders the GROUP BY segment.
   *
   * <p>A list consisting of the wildcard alone renders as {@code GROUP BY *} without validation.
   * Otherwise fill directives are moved behind all other directives and separated by a space
   * instead of a comma, e.g. {@code GROUP BY time(2d),"host" fill(null)}.
   *
   * @param directives The GROUP BY directives, or null if the request has none
   * @param groups The desugared condition groups, used to check for a time bound
   * @return " GROUP BY ..." text, an empty segment, or an {@link InvalidGroupByDirective} error
   */
  public ClauseResult renderGroupBy(List<GroupDirective> directives, List<List<Condition>> groups) {
    if (directives == null || directives.isEmpty()) {
      return ClauseResult.empty();
    }
    if (directives.size() == 1 && directives.get(0).kind() == GroupDirective.Kind.WILDCARD) {
      return ClauseResult.of(GROUP_BY_KEYWORD + GroupDirective.WILDCARD_TEXT);
    }

    boolean hasTimeCondition =
        groups.stream().flatMap(List::stream).anyMatch(Condition::isTimeCondition);

    List<String> rendered = new ArrayList<>();
    List<String> fills = new ArrayList<>();
    List<DirectiveViolation> violations = new ArrayList<>();

    for (GroupDirective directive : directives) {
      switch (directive.kind()) {
        case TIME_BUCKET -> {
          if (hasTimeCondition) {
            rendered.add(directive.text());
          } else {
            violations.add(new DirectiveViolation(directive.text(), MISSING_TIME_CONDITION));
          }
        }
        case FILL -> {
          if (directive.fillOption().filter(ValuePatternUtils::isValidFillOption).isPresent()) {
            fills.add(directive.text());
          } else {
            violations.add(new DirectiveViolation(directive.text(), INVALID_FILL_OPTION));
          }
        }
        case WILDCARD -> rendered.add(directive.text());
        case TAG -> rendered.add(valueClassifier.render(directive.text(), QuotingMode.IDENTIFIER));
      }
    }

    if (!violations.isEmpty()) {
      log.warn("ClauseAssembler: Rejected GROUP BY directive(s): {}", violations);
      return ClauseResult.failed(new InvalidGroupByDirective(violations));
    }

    String clause = joinDirectives(rendered, fills);
    log.debug("ClauseAssembler: Built GROUP BY clause '{}'", clause);
    return ClauseResult.of(GROUP_BY_KEYWORD + clause);
  }

  // Fill must be the last element of a GROUP BY list and is not comma separated
  private static String joinDirectives(List<String> directives, List<String> fills) {
    StringBuilder joined = new StringBuilder(String.join(",", directives));
    for (String fill : fills) {
      if (joined.length() > 0) {
        joined.append(' ');
      }
      joined.append(fill);
    }
    return joined.toString();
  }
}
