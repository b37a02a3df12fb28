package com.phillippitts.grillstats.service.profile;

import com.phillippitts.grillstats.domain.ProbeType;
import com.phillippitts.grillstats.exception.ProfileNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileLibraryTest {

    private final ProfileLibrary library = new ProfileLibrary();

    @Test
    void exposesWholeCatalogue() {
        assertThat(library.profiles()).hasSize(CookingProfiles.ALL.size());
        assertThat(library.get("beef_brisket_smoking")).isSameAs(CookingProfiles.BRISKET_SMOKING);
    }

    @Test
    void unknownProfileFailsWithItsId() {
        assertThatThrownBy(() -> library.get("tofu_sous_vide"))
                .isInstanceOf(ProfileNotFoundException.class)
                .hasMessageContaining("tofu_sous_vide");
    }

    @Test
    void brisketHasStallBetweenRises() {
        CookingProfile brisket = CookingProfiles.BRISKET_SMOKING;

        assertThat(brisket.phaseCount()).isEqualTo(3);
        assertThat(brisket.phase(1).stall()).isTrue();
        assertThat(brisket.phase(1).targetTemperature()).isEqualTo(168.0);
        assertThat(brisket.phase(2).targetTemperature()).isEqualTo(203.0);
    }

    @ParameterizedTest
    @CsvSource({
            "Brisket Internal, FOOD, beef_brisket_smoking",
            "Ribeye Steak, FOOD, beef_steak_grilling",
            "Pulled Pork, FOOD, pork_shoulder_smoking",
            "Baby Back Ribs, FOOD, pork_ribs_smoking",
            "Whole Chicken, FOOD, chicken_whole_roasting",
            "Salmon, FOOD, fish_grilling",
            "Thanksgiving Turkey, FOOD, turkey_whole_roasting",
            "Pit Ambient, AMBIENT, smoker_pit",
            "Grill Surface, SURFACE, grill_pit",
            "Oven Air, AMBIENT, oven",
            "Smoker Pit, FOOD, smoker_pit"
    })
    void matchesProfileByProbeName(String name, ProbeType type, String expectedId) {
        assertThat(library.matchByProbeName(name, type))
                .hasValueSatisfying(p -> assertThat(p.id()).isEqualTo(expectedId));
    }

    @Test
    void foodProbeWithMeaninglessNameMatchesNothing() {
        assertThat(library.matchByProbeName("Probe 3", ProbeType.FOOD)).isEmpty();
        assertThat(library.matchByProbeName(null, ProbeType.FOOD)).isEmpty();
    }

    @Test
    void nonFoodProbeAlwaysGetsPitProfile() {
        assertThat(library.matchByProbeName("Probe 3", ProbeType.AMBIENT))
                .hasValue(CookingProfiles.SMOKER_PIT);
    }
}
