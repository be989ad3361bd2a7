package com.evoila.influxql.compiler.core;

import com.evoila.influxql.compiler.model.dto.Comparator;
import com.evoila.influxql.compiler.model.dto.Condition;
import com.evoila.influxql.compiler.model.dto.QuotingMode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders a single WHERE condition as {@code <field> <comparator> <value>}.
 *
 * <p>String values are quoted with single quotes. A condition whose comparator is not one of the
 * supported operators renders to an empty Optional; the caller collects those conditions so that
 * every invalid one can be reported together.
 */
@Slf4j
@RequiredArgsConstructor
public final class ConditionRenderer {

  private final ValueClassifier valueClassifier;

  /**
   * Renders a condition.
   *
   * @param condition The condition to render
   * @return The condition text, or empty if the comparator is not supported
   */
  public Optional<String> render(Condition condition) {
    Optional<Comparator> comparator = Comparator.fromSymbol(condition.comparator());
    if (comparator.isEmpty()) {
      log.debug(
          "ConditionRenderer: Rejecting comparator '{}' on field '{}'",
          condition.comparator(),
          condition.field());
      return Optional.empty();
    }

    String value = valueClassifier.render(condition.value(), QuotingMode.LITERAL);
    return Optional.of(condition.field() + " " + comparator.get().getSymbol() + " " + value);
  }
}
