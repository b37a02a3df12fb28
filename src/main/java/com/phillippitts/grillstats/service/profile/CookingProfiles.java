package com.phillippitts.grillstats.service.profile;

import com.phillippitts.grillstats.domain.ProbeType;

import java.util.List;

/**
 * Built-in profile catalogue. All temperatures are degrees F, rates are degrees F per minute.
 */
public final class CookingProfiles {

    public static final CookingProfile BRISKET_SMOKING = food("beef_brisket_smoking",
            "Low and slow smoked brisket with stall", CookingMethod.SMOKING,
            Phase.rise("initial_rise", 160, 1.0, 1.5, 60, 150, 0.3),
            Phase.stall("stall", 168, 0.05, 0.15, 120, 240, 1.5),
            Phase.rise("final_rise", 203, 0.2, 0.4, 60, 240, 0.4));

    public static final CookingProfile STEAK_GRILLING = food("beef_steak_grilling",
            "High heat grilled steak", CookingMethod.GRILLING,
            Phase.rise("rapid_rise", 130, 3.0, 10.0, 3, 15, 1.0),
            Phase.hold("resting", 128, 0.1, 0.3, 3, 10, 0.2));

    public static final CookingProfile PORK_SHOULDER_SMOKING = food("pork_shoulder_smoking",
            "Low and slow smoked pork shoulder", CookingMethod.SMOKING,
            Phase.rise("initial_rise", 155, 0.8, 1.2, 90, 180, 0.4),
            Phase.stall("stall", 165, 0.05, 0.2, 120, 300, 1.5),
            Phase.rise("final_rise", 203, 0.2, 0.5, 60, 240, 0.4));

    public static final CookingProfile PORK_RIBS_SMOKING = food("pork_ribs_smoking",
            "Smoked pork ribs", CookingMethod.SMOKING,
            Phase.rise("initial_rise", 120, 1.0, 1.8, 45, 90, 0.5),
            Phase.rise("middle_phase", 165, 0.3, 0.7, 60, 150, 0.4),
            Phase.rise("final_rise", 198, 0.2, 0.5, 30, 150, 0.3));

    public static final CookingProfile CHICKEN_WHOLE_ROASTING = food("chicken_whole_roasting",
            "Whole roasted chicken", CookingMethod.ROASTING,
            Phase.rise("initial_rise", 90, 2.0, 3.0, 15, 30, 0.6),
            Phase.rise("middle_phase", 145, 1.0, 1.5, 30, 60, 0.4),
            Phase.rise("final_approach", 168, 0.5, 1.0, 15, 45, 0.3));

    public static final CookingProfile CHICKEN_BREAST_GRILLING = food("chicken_breast_grilling",
            "Grilled chicken breast", CookingMethod.GRILLING,
            Phase.rise("rapid_rise", 140, 3.0, 5.0, 5, 30, 0.7),
            Phase.rise("final_approach", 163, 1.0, 2.0, 3, 20, 0.5));

    public static final CookingProfile FISH_GRILLING = food("fish_grilling",
            "Grilled fish fillet", CookingMethod.GRILLING,
            Phase.rise("rapid_rise", 125, 6.0, 12.0, 2, 15, 1.2),
            Phase.rise("final_approach", 140, 2.0, 4.0, 1, 10, 0.5));

    public static final CookingProfile TURKEY_WHOLE_ROASTING = food("turkey_whole_roasting",
            "Whole roasted turkey", CookingMethod.ROASTING,
            Phase.rise("initial_rise", 100, 1.0, 2.0, 45, 90, 0.5),
            Phase.rise("middle_phase", 150, 0.5, 1.0, 90, 180, 0.4),
            Phase.rise("final_approach", 168, 0.3, 0.6, 30, 90, 0.3));

    public static final CookingProfile SMOKER_PIT = pit("smoker_pit",
            "Smoker pit held at 225-275", CookingMethod.SMOKING,
            Phase.rise("warm_up", 250, 3.0, 6.0, 15, 90, 2.0),
            Phase.hold("cook", 250, 0.5, 1.0, 240, 720, 6.0));

    public static final CookingProfile GRILL_PIT = pit("grill_pit",
            "Grill grate at high heat", CookingMethod.GRILLING,
            Phase.rise("warm_up", 400, 10.0, 20.0, 10, 45, 5.0),
            Phase.hold("cook", 400, 2.0, 4.0, 60, 240, 15.0));

    public static final CookingProfile OVEN = pit("oven",
            "Oven or roaster at moderate heat", CookingMethod.ROASTING,
            Phase.rise("preheat", 350, 8.0, 15.0, 10, 45, 2.0),
            Phase.hold("cook", 350, 1.0, 2.0, 60, 300, 4.0));

    public static final List<CookingProfile> ALL = List.of(
            BRISKET_SMOKING,
            STEAK_GRILLING,
            PORK_SHOULDER_SMOKING,
            PORK_RIBS_SMOKING,
            CHICKEN_WHOLE_ROASTING,
            CHICKEN_BREAST_GRILLING,
            FISH_GRILLING,
            TURKEY_WHOLE_ROASTING,
            SMOKER_PIT,
            GRILL_PIT,
            OVEN);

    private CookingProfiles() {
        // Constants holder
    }

    private static CookingProfile food(String id, String description, CookingMethod method, Phase... phases) {
        return new CookingProfile(id, description, method, ProbeType.FOOD, List.of(phases));
    }

    private static CookingProfile pit(String id, String description, CookingMethod method, Phase... phases) {
        return new CookingProfile(id, description, method, ProbeType.AMBIENT, List.of(phases));
    }
}
