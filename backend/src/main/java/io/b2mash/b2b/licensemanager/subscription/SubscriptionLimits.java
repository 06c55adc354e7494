package io.b2mash.b2b.licensemanager.subscription;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Static limits applied to subscription plan submissions.
 *
 * @param minNumLicenses smallest license count a plan may be submitted with
 * @param maxNumLicenses largest license count of a plan that is not for internal use only
 * @param defaultRevokeMaxPercentage revocation cap used when a submission leaves it unset
 * @param defaultLicenseDurationBeforePurge purge delay of new agreements that leave it unset
 */
@ConfigurationProperties(prefix = "license-manager.subscriptions")
public record SubscriptionLimits(
    @DefaultValue("0") int minNumLicenses,
    @DefaultValue("10000") int maxNumLicenses,
    @DefaultValue("5") int defaultRevokeMaxPercentage,
    @DefaultValue("90d") Duration defaultLicenseDurationBeforePurge) {

  public SubscriptionLimits {
    if (minNumLicenses < 0 || maxNumLicenses < minNumLicenses) {
      throw new IllegalArgumentException(
          "Invalid license limits: min=" + minNumLicenses + ", max=" + maxNumLicenses);
    }
  }
}
