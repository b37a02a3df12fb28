package com.phillippitts.grillstats.service.profile;

/**
 * How the food is cooked; selects the pit profile used for ambient probes.
 */
public enum CookingMethod {
    SMOKING,
    GRILLING,
    ROASTING
}
