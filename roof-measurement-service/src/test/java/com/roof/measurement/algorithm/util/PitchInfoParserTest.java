package com.roof.measurement.algorithm.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PitchInfoParserTest {

    @Test
    void parsesRatioWithColonOrSlash() {
        assertThat(PitchInfoParser.parseDegrees("6:12").orElseThrow()).isCloseTo(26.565, within(0.001));
        assertThat(PitchInfoParser.parseDegrees("Predominant pitch 4/12").orElseThrow()).isCloseTo(18.435, within(0.001));
    }

    @Test
    void parsesDegrees() {
        assertThat(PitchInfoParser.parseDegrees("26.5 degrees").orElseThrow()).isEqualTo(26.5);
        assertThat(PitchInfoParser.parseDegrees("18°").orElseThrow()).isEqualTo(18.0);
        assertThat(PitchInfoParser.parseDegrees("22").orElseThrow()).isEqualTo(22.0);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "steep", "95 degrees"})
    void rejectsUnusableText(String text) {
        assertThat(PitchInfoParser.parseDegrees(text)).isEmpty();
    }

    @Test
    void buildingTagsMapToTypicalPitch() {
        assertThat(BuildingType.fromTag("House").getTypicalPitchDegrees()).isEqualTo(18.4);
        assertThat(BuildingType.fromTag("detached")).isEqualTo(BuildingType.DETACHED);
        assertThat(BuildingType.fromTag("warehouse").getTypicalPitchDegrees()).isEqualTo(3.0);
        assertThat(BuildingType.fromTag("church")).isEqualTo(BuildingType.UNKNOWN);
        assertThat(BuildingType.fromTag(null)).isEqualTo(BuildingType.UNKNOWN);
    }
}
