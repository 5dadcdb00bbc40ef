/*
 * PatternMatcher.java - Detects sensitive data patterns in field names and sample values
 */
package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches a field against an ordered table of named regular expressions.
 * A rule can match on the field name (the rule name or one of its synonyms is contained in it)
 * and separately on the sample values, so one rule may contribute two matches.
 * Pure and deterministic; results are returned in rule order.
 */
@Component
public class PatternMatcher {

    static final double NAME_MATCH_CONFIDENCE = 0.8;
    private static final int MAX_SAMPLE_EXAMPLES = 3;

    private static final List<PatternRule> RULES = new ArrayList<>();

    static {
        // Personal identifiers
        RULES.add(rule("email", "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$", "mail"));
        RULES.add(rule("phone", "^[\\+]?[(]?[0-9]{3}[)]?[-\\s\\.]?[0-9]{3}[-\\s\\.]?[0-9]{4,6}$",
                "tel", "mobile"));
        RULES.add(rule("ssn", "^(?!000|666)[0-8][0-9]{2}-(?!00)[0-9]{2}-(?!0000)[0-9]{4}$", "social"));
        RULES.add(rule("passport", "^[A-Z][0-9]{8}$"));
        RULES.add(rule("driverLicense", "^[A-Z]{1,2}[0-9]{5,6}$"));

        // Financial
        RULES.add(rule("creditCard", "^(?:4[0-9]{12}(?:[0-9]{3})?|5[1-5][0-9]{14}|3[47][0-9]{13}"
                        + "|3(?:0[0-5]|[68][0-9])[0-9]{11}|6(?:011|5[0-9]{2})[0-9]{12}|(?:2131|1800|35\\d{3})\\d{11})$",
                "card", "payment"));
        RULES.add(rule("iban", "^[A-Z]{2}[0-9]{2}[A-Z0-9]{4}[0-9]{7}([A-Z0-9]?){0,16}$"));
        RULES.add(rule("routingNumber", "^[0-9]{9}$"));
        RULES.add(rule("bitcoinAddress", "^(bc1|[13])[a-zA-HJ-NP-Z0-9]{25,39}$"));

        // Health
        RULES.add(rule("npi", "^[0-9]{10}$"));
        RULES.add(rule("medicareId", "^[0-9]{3}-[0-9]{2}-[0-9]{4}[A-Z]$"));

        // Technical
        RULES.add(rule("ipv4", "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}"
                        + "(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$"));
        RULES.add(rule("ipv6", "^(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$"));
        RULES.add(rule("macAddress", "^([0-9A-Fa-f]{2}[:-]){5}([0-9A-Fa-f]{2})$"));
        RULES.add(rule("apiKey", "^[A-Za-z0-9_-]{32,}$"));
        RULES.add(rule("jwt", "^[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+$"));

        // Quasi-identifiers
        RULES.add(rule("latitude", "^-?([0-8]?[0-9]|90)(\\.[0-9]{1,10})?$"));
        RULES.add(rule("longitude", "^-?((1[0-7]|[0-9])?[0-9]|180)(\\.[0-9]{1,10})?$"));
        RULES.add(rule("zipCode", "^\\d{5}(-\\d{4})?$"));
    }

    /**
     * Matches a field against every rule.
     *
     * @param fieldName Field name, may be null
     * @param samples Sample values, may be null or contain nulls
     * @return Matches in rule order, at most two per rule
     */
    public List<PatternMatch> match(String fieldName, List<String> samples) {
        String lowerName = fieldName != null ? fieldName.toLowerCase(Locale.ROOT) : "";
        List<String> values = samples != null ? samples : Collections.emptyList();

        List<PatternMatch> matches = new ArrayList<>();
        for (PatternRule rule : RULES) {
            if (!lowerName.isEmpty() && rule.matchesName(lowerName)) {
                matches.add(PatternMatch.builder()
                        .type(rule.name)
                        .pattern(rule.pattern.pattern())
                        .matches(1)
                        .samples(new ArrayList<>())
                        .confidence(NAME_MATCH_CONFIDENCE)
                        .build());
            }

            if (values.isEmpty()) {
                continue;
            }

            List<String> matching = values.stream()
                    .filter(v -> v != null && !v.isEmpty())
                    .filter(v -> rule.pattern.matcher(v).matches())
                    .collect(Collectors.toList());

            if (!matching.isEmpty()) {
                matches.add(PatternMatch.builder()
                        .type(rule.name)
                        .pattern(rule.pattern.pattern())
                        .matches(matching.size())
                        .samples(matching.stream().limit(MAX_SAMPLE_EXAMPLES).collect(Collectors.toList()))
                        .confidence(Math.min((double) matching.size() / values.size(), 1.0))
                        .build());
            }
        }
        return matches;
    }


    private static PatternRule rule(String name, String regex, String... synonyms) {
        return new PatternRule(name, Pattern.compile(regex), List.of(synonyms));
    }

    private static final class PatternRule {
        private final String name;
        private final String lowerName;
        private final Pattern pattern;
        private final List<String> synonyms;

        private PatternRule(String name, Pattern pattern, List<String> synonyms) {
            this.name = name;
            this.lowerName = name.toLowerCase(Locale.ROOT);
            this.pattern = pattern;
            this.synonyms = synonyms;
        }

        private boolean matchesName(String lowerFieldName) {
            return lowerFieldName.contains(lowerName) || synonyms.stream().anyMatch(lowerFieldName::contains);
        }
    }
}
