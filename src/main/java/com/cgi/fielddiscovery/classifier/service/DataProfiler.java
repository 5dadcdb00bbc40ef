package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.enums.Distribution;
import com.cgi.fielddiscovery.classifier.model.enums.ValueFormat;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Computes a statistical profile of a field from its sample values.
 * Samples are only read during the call; the profile keeps no reference to them.
 */
@Component
public class DataProfiler {

    private static final double UNIQUE_THRESHOLD = 0.95;
    private static final double CATEGORICAL_THRESHOLD = 0.1;

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final Pattern DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    /**
     * Profiles a sample.
     *
     * @param samples Sample values, may be null, empty or contain nulls
     * @return Profile, all zero with unknown labels when there are no samples
     */
    public DataProfile profile(List<String> samples) {
        if (samples == null || samples.isEmpty()) {
            return DataProfile.empty();
        }

        int total = samples.size();
        Map<String, Integer> frequencies = new HashMap<>();
        int nullCount = 0;
        String firstValue = null;

        for (String value : samples) {
            frequencies.merge(String.valueOf(value), 1, Integer::sum);
            if (value == null || value.isEmpty()) {
                nullCount++;
            } else if (firstValue == null) {
                firstValue = value;
            }
        }

        double uniqueness = (double) frequencies.size() / total;

        return DataProfile.builder()
                .uniqueness(uniqueness)
                .nullability((double) nullCount / total)
                .cardinality(frequencies.size())
                .entropy(entropy(frequencies, total))
                .distribution(distribution(uniqueness))
                .format(format(firstValue))
                .build();
    }

    private static double entropy(Map<String, Integer> frequencies, int total) {
        double entropy = 0;
        for (int count : frequencies.values()) {
            double p = (double) count / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    private static Distribution distribution(double uniqueness) {
        if (uniqueness > UNIQUE_THRESHOLD) {
            return Distribution.UNIQUE;
        }
        if (uniqueness < CATEGORICAL_THRESHOLD) {
            return Distribution.CATEGORICAL;
        }
        return Distribution.MIXED;
    }

    private static ValueFormat format(String value) {
        if (value == null) {
            return ValueFormat.UNKNOWN;
        }
        if (NUMERIC.matcher(value).matches()) {
            return ValueFormat.NUMERIC;
        }
        if (DATE_PREFIX.matcher(value).lookingAt()) {
            return ValueFormat.DATE;
        }
        if (EMAIL.matcher(value).matches()) {
            return ValueFormat.EMAIL;
        }
        return ValueFormat.TEXT;
    }
}
