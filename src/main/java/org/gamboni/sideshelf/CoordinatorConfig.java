package org.gamboni.sideshelf;

import lombok.With;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tuning of the coordinator.
 *
 * @param minPlausiblePosition session positions below this many seconds are suspected to be the position the
 *                             native player reports before it has seeked to the resume point
 * @param largeDiscrepancyThreshold when session and saved progress differ by more than this many seconds, the most
 *                                  recently updated one wins
 * @param historySize capacity of the transition and diagnostic histories
 */
@With
public record CoordinatorConfig(double minPlausiblePosition, double largeDiscrepancyThreshold, int historySize) {
    public static final CoordinatorConfig DEFAULTS = new CoordinatorConfig(5, 30, 100);

    public CoordinatorConfig {
        checkArgument(minPlausiblePosition >= 0, "minPlausiblePosition must not be negative");
        checkArgument(largeDiscrepancyThreshold >= 0, "largeDiscrepancyThreshold must not be negative");
        checkArgument(historySize > 0, "historySize must be positive");
    }
}
