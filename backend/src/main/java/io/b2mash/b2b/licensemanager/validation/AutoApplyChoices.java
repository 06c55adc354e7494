package io.b2mash.b2b.licensemanager.validation;

import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Options for the plan used for auto-applied licenses of a customer agreement: the empty option
 * first, then one option per plan, plus the preselected option.
 *
 * @param options the empty option followed by one option per candidate plan, in query order
 * @param selected the option matching the current auto-applicable plan, or the empty option
 */
public record AutoApplyChoices(List<AutoApplyChoice> options, AutoApplyChoice selected) {

  public AutoApplyChoices {
    options = List.copyOf(options);
  }

  /**
   * Maps candidate plans to options. Pure: performs no lookups. The current plan is only
   * preselected when it is one of the candidates.
   *
   * @param plans the plans eligible for auto-applied licenses
   * @param currentPlanId id of the agreement's current auto-applicable plan, may be null
   */
  public static AutoApplyChoices present(List<SubscriptionPlan> plans, UUID currentPlanId) {
    var options = new ArrayList<AutoApplyChoice>(plans.size() + 1);
    options.add(AutoApplyChoice.EMPTY);
    var selected = AutoApplyChoice.EMPTY;
    for (var plan : plans) {
      var option = new AutoApplyChoice(plan.getId().toString(), plan.getTitle());
      options.add(option);
      if (plan.getId().equals(currentPlanId)) {
        selected = option;
      }
    }
    return new AutoApplyChoices(options, selected);
  }

  /** True when {@code value} is one of the offered option values. */
  public boolean offers(String value) {
    return options.stream().anyMatch(o -> o.value().equals(value));
  }
}
