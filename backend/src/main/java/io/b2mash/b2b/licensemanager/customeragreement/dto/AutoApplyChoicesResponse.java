package io.b2mash.b2b.licensemanager.customeragreement.dto;

import io.b2mash.b2b.licensemanager.validation.AutoApplyChoices;
import java.util.List;

public record AutoApplyChoicesResponse(List<ChoiceResponse> choices, String initial) {

  public static AutoApplyChoicesResponse from(AutoApplyChoices choices) {
    return new AutoApplyChoicesResponse(
        choices.options().stream().map(o -> new ChoiceResponse(o.value(), o.label())).toList(),
        choices.selected().value());
  }

  public record ChoiceResponse(String value, String label) {}
}
