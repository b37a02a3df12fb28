package com.phillippitts.grillstats.domain;

/** Physical placement of a probe. */
public enum ProbeType {
    FOOD,
    AMBIENT,
    SURFACE
}
