package io.b2mash.b2b.licensemanager.validation;

/**
 * One selectable option of the auto-applied licenses choice list.
 *
 * @param value the plan id, or the empty string for "no plan"
 * @param label the plan title, or a dash placeholder for "no plan"
 */
public record AutoApplyChoice(String value, String label) {

  public static final AutoApplyChoice EMPTY = new AutoApplyChoice("", "------");

  public boolean isEmpty() {
    return value.isEmpty();
  }
}
