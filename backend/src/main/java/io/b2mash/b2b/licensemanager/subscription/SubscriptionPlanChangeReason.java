package io.b2mash.b2b.licensemanager.subscription;

/** Why a subscription plan was created or changed. Recorded with the plan's audit event. */
public enum SubscriptionPlanChangeReason {
  NEW("New"),
  EXPANSION("Expansion"),
  RENEWAL("Renewal"),
  CONTRACTION("Contraction"),
  DELAYED_PAYMENT("Delayed payment"),
  OTHER("Other");

  private final String displayLabel;

  SubscriptionPlanChangeReason(String displayLabel) {
    this.displayLabel = displayLabel;
  }

  public String getDisplayLabel() {
    return displayLabel;
  }
}
