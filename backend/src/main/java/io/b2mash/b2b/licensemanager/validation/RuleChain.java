package io.b2mash.b2b.licensemanager.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of {@link ValidationRule}s evaluated in registration order. Evaluation stops at the
 * first violated rule, so the reported field and message are fully determined by rule order.
 *
 * @param <T> the submission type the rules inspect
 */
public final class RuleChain<T> {

  private static final Logger log = LoggerFactory.getLogger(RuleChain.class);

  private final String name;
  private final List<ValidationRule<T>> rules;

  private RuleChain(String name, List<ValidationRule<T>> rules) {
    this.name = name;
    this.rules = List.copyOf(rules);
  }

  public static <T> Builder<T> builder(String name) {
    return new Builder<>(name);
  }

  public ValidationOutcome evaluate(T subject) {
    for (var rule : rules) {
      if (rule.isViolatedBy(subject)) {
        log.debug("Rule chain {} rejected submission: field={}", name, rule.field());
        return new ValidationOutcome(List.of(rule.toRejection()));
      }
    }
    return ValidationOutcome.accept();
  }

  String getName() {
    return name;
  }

  List<ValidationRule<T>> getRules() {
    return rules;
  }

  public static final class Builder<T> {

    private final String name;
    private final List<ValidationRule<T>> rules = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder<T> rule(String field, Predicate<T> violation, String message) {
      rules.add(new ValidationRule<>(field, violation, message));
      return this;
    }

    public RuleChain<T> build() {
      return new RuleChain<>(name, rules);
    }
  }
}
