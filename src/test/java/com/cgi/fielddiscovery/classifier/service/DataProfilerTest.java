package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.enums.Distribution;
import com.cgi.fielddiscovery.classifier.model.enums.ValueFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DataProfiler")
class DataProfilerTest {

    private final DataProfiler profiler = new DataProfiler();

    @Test
    void emptyInputGivesEmptyProfile() {
        DataProfile profile = profiler.profile(Collections.emptyList());

        assertThat(profile.getUniqueness()).isZero();
        assertThat(profile.getCardinality()).isZero();
        assertThat(profile.getDistribution()).isEqualTo(Distribution.UNKNOWN);
        assertThat(profile.getFormat()).isEqualTo(ValueFormat.UNKNOWN);
        assertThat(profiler.profile(null).getFormat()).isEqualTo(ValueFormat.UNKNOWN);
    }

    @Test
    @DisplayName("All distinct values are unique with log2(n) entropy")
    void uniqueValues() {
        DataProfile profile = profiler.profile(List.of("a@x.io", "b@x.io", "c@x.io", "d@x.io"));

        assertThat(profile.getUniqueness()).isEqualTo(1.0);
        assertThat(profile.getCardinality()).isEqualTo(4);
        assertThat(profile.getEntropy()).isCloseTo(2.0, within(1e-9));
        assertThat(profile.getDistribution()).isEqualTo(Distribution.UNIQUE);
        assertThat(profile.getFormat()).isEqualTo(ValueFormat.EMAIL);
    }

    @Test
    @DisplayName("Repeated values are categorical")
    void categoricalValues() {
        String[] values = new String[25];
        Arrays.fill(values, "active");
        values[0] = "inactive";

        DataProfile profile = profiler.profile(Arrays.asList(values));

        assertThat(profile.getCardinality()).isEqualTo(2);
        assertThat(profile.getUniqueness()).isCloseTo(0.08, within(1e-9));
        assertThat(profile.getDistribution()).isEqualTo(Distribution.CATEGORICAL);
        assertThat(profile.getFormat()).isEqualTo(ValueFormat.TEXT);
    }

    @Test
    @DisplayName("Null and empty values count towards nullability; format comes from the first non-empty value")
    void nullability() {
        DataProfile profile = profiler.profile(Arrays.asList(null, "", "12345", "67890"));

        assertThat(profile.getNullability()).isEqualTo(0.5);
        assertThat(profile.getFormat()).isEqualTo(ValueFormat.NUMERIC);
        assertThat(profile.getDistribution()).isEqualTo(Distribution.UNIQUE);
    }

    @Test
    void dateFormatDetected() {
        DataProfile profile = profiler.profile(List.of("2024-01-15T10:00:00", "2024-02-01"));

        assertThat(profile.getFormat()).isEqualTo(ValueFormat.DATE);
    }
}
