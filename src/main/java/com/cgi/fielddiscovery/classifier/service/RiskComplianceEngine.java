/*
 * RiskComplianceEngine.java - Risk tiering and regulatory mapping of classified fields
 */
package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.ComplianceFlag;
import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.enums.ComplianceStatus;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the risk tier, compliance flags, recommendations, access and retention policies of a field
 * from its pattern matches, semantic classification and profile.
 * Pure: all decisions come from static tables, evaluated in a fixed order.
 */
@Component
public class RiskComplianceEngine {

    static final int MAX_RECOMMENDATIONS = 5;
    private static final int MAX_ACTIONS = 3;
    private static final double HIGH_UNIQUENESS = 0.9;

    private static final Set<String> CRITICAL_PATTERNS = Set.of("ssn", "creditCard", "apiKey", "jwt");
    private static final Set<String> HIGH_PATTERNS = Set.of("email", "phone", "iban");
    private static final Set<String> CREDENTIAL_PATTERNS = Set.of("password", "apiKey");

    private static final Map<String, Framework> FRAMEWORKS = new LinkedHashMap<>();

    static {
        register("GDPR", List.of(DataCategory.PERSONAL_DATA), List.of(
                "Data minimization", "Purpose limitation", "Storage limitation", "Accuracy",
                "Integrity and confidentiality", "Lawful basis", "Consent management",
                "Right to erasure", "Data portability"));
        register("CCPA", List.of(DataCategory.PERSONAL_DATA), List.of(
                "Right to know", "Right to delete", "Right to opt-out", "Right to non-discrimination",
                "Notice at collection", "Privacy policy"));
        register("HIPAA", List.of(DataCategory.HEALTH_DATA), List.of(
                "Privacy Rule", "Security Rule", "Breach Notification Rule", "Minimum Necessary Standard",
                "Administrative Safeguards", "Physical Safeguards", "Technical Safeguards"));
        register("PCI-DSS", List.of(DataCategory.FINANCIAL_DATA), List.of(
                "Build and maintain secure network", "Protect cardholder data",
                "Maintain vulnerability management", "Implement access control",
                "Regular monitoring and testing", "Information security policy"));
        register("SOX", List.of(DataCategory.FINANCIAL_DATA, DataCategory.BUSINESS_DATA), List.of(
                "Internal controls", "Financial reporting accuracy", "Audit trails", "Data retention",
                "Access controls"));
        register("FERPA", List.of(DataCategory.PERSONAL_DATA), List.of(
                "Education records protection", "Parent/student access rights", "Consent for disclosure",
                "Directory information", "Audit requirements"));
        register("COPPA", List.of(DataCategory.PERSONAL_DATA), List.of(
                "Parental consent", "Notice requirements", "Disclosure obligations", "Data deletion rights",
                "Security measures"));
    }

    /**
     * Assesses a classified field.
     *
     * @param patterns Pattern matches of the field
     * @param classification Semantic classification
     * @param profile Data profile
     * @return Risk assessment
     */
    public RiskAssessment assess(List<PatternMatch> patterns, SemanticClassification classification,
                                 DataProfile profile) {
        List<PatternMatch> matches = patterns != null ? patterns : Collections.emptyList();
        DataProfile dataProfile = profile != null ? profile : DataProfile.empty();
        DataCategory category = classification.getCategory();

        RiskLevel riskLevel = riskLevel(matches, classification, dataProfile);
        List<ComplianceFlag> flags = complianceFlags(category);

        return RiskAssessment.builder()
                .riskLevel(riskLevel)
                .complianceFlags(flags)
                .regulations(regulations(category))
                .recommendations(recommendations(category, matches, riskLevel, flags))
                .accessRestrictions(accessRestrictions(riskLevel, category))
                .retentionPolicy(retentionPolicy(category, flags))
                .geoRestrictions(geoRestrictions(flags))
                .encryptionRequired(riskLevel.isAtLeastHigh())
                .build();
    }

    /**
     * Risk tier; the first matching tier wins.
     */
    RiskLevel riskLevel(List<PatternMatch> patterns, SemanticClassification classification, DataProfile profile) {
        DataCategory category = classification.getCategory();
        String subcategory = classification.getSubcategory();

        if (category == DataCategory.HEALTH_DATA
                || "Credentials".equals(subcategory)
                || "PII".equals(subcategory)
                || anyPattern(patterns, CRITICAL_PATTERNS)) {
            return RiskLevel.CRITICAL;
        }

        if (category == DataCategory.FINANCIAL_DATA
                || category == DataCategory.PERSONAL_DATA
                || anyPattern(patterns, HIGH_PATTERNS)) {
            return RiskLevel.HIGH;
        }

        if (profile.getUniqueness() > HIGH_UNIQUENESS
                || "Internal".equals(subcategory)
                || "System".equals(subcategory)) {
            return RiskLevel.MEDIUM;
        }

        return RiskLevel.LOW;
    }

    List<ComplianceFlag> complianceFlags(DataCategory category) {
        List<ComplianceFlag> flags = new ArrayList<>();
        FRAMEWORKS.forEach((name, framework) -> {
            if (framework.categories.contains(category)) {
                List<String> relevant = framework.requirements.subList(0,
                        Math.min(MAX_ACTIONS, framework.requirements.size()));
                flags.add(ComplianceFlag.builder()
                        .framework(name)
                        .requirement(relevant.get(0))
                        .status(ComplianceStatus.NEEDS_REVIEW)
                        .actions(relevant.stream()
                                .map(req -> "Ensure " + req.toLowerCase(Locale.ROOT))
                                .collect(Collectors.toList()))
                        .build());
            }
        });
        return flags;
    }

    List<String> regulations(DataCategory category) {
        return FRAMEWORKS.entrySet().stream()
                .filter(e -> e.getValue().categories.contains(category))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private List<String> recommendations(DataCategory category, List<PatternMatch> patterns,
                                         RiskLevel riskLevel, List<ComplianceFlag> flags) {
        Set<String> recommendations = new LinkedHashSet<>();

        if (riskLevel.isAtLeastHigh()) {
            recommendations.add("Enable encryption at rest and in transit");
            recommendations.add("Implement access logging and monitoring");
            recommendations.add("Apply data masking in non-production environments");
        }

        if (category == DataCategory.PERSONAL_DATA) {
            recommendations.add("Implement consent management");
            recommendations.add("Enable data subject request handling");
            recommendations.add("Set up data retention policies");
        } else if (category == DataCategory.HEALTH_DATA) {
            recommendations.add("Ensure HIPAA compliance");
            recommendations.add("Implement audit trails");
            recommendations.add("Apply minimum necessary access principle");
        } else if (category == DataCategory.FINANCIAL_DATA) {
            recommendations.add("Enable PCI-DSS compliance measures");
            recommendations.add("Implement tokenization where possible");
            recommendations.add("Set up fraud detection monitoring");
        }

        if (anyPattern(patterns, Set.of("creditCard"))) {
            recommendations.add("Never store CVV/CVC codes");
            recommendations.add("Implement PAN truncation");
        }

        if (anyPattern(patterns, CREDENTIAL_PATTERNS)) {
            recommendations.add("Use secure key management service");
            recommendations.add("Rotate credentials regularly");
        }

        for (ComplianceFlag flag : flags) {
            if (flag.getStatus() == ComplianceStatus.NEEDS_REVIEW) {
                recommendations.add("Review " + flag.getFramework() + " compliance: " + flag.getRequirement());
            }
        }

        return recommendations.stream().limit(MAX_RECOMMENDATIONS).collect(Collectors.toList());
    }

    private List<String> accessRestrictions(RiskLevel riskLevel, DataCategory category) {
        List<String> restrictions = new ArrayList<>();

        if (riskLevel == RiskLevel.CRITICAL) {
            restrictions.add("Require multi-factor authentication");
            restrictions.add("Limit to specific IP addresses");
            restrictions.add("Require privileged access management");
        } else if (riskLevel == RiskLevel.HIGH) {
            restrictions.add("Require strong authentication");
            restrictions.add("Implement role-based access control");
        }

        if (category == DataCategory.HEALTH_DATA) {
            restrictions.add("Limit to healthcare professionals");
            restrictions.add("Require BAA for third-party access");
        } else if (category == DataCategory.FINANCIAL_DATA) {
            restrictions.add("Require PCI compliance certification");
            restrictions.add("Limit to finance team members");
        }

        return restrictions;
    }

    private String retentionPolicy(DataCategory category, List<ComplianceFlag> flags) {
        if (hasFramework(flags, "GDPR")) {
            return "Retain only as long as necessary for specified purpose";
        }
        if (hasFramework(flags, "HIPAA")) {
            return "Minimum 6 years as per HIPAA requirements";
        }

        if (category == null) {
            return "3 years standard retention";
        }
        switch (category) {
            case PERSONAL_DATA:
                return "3 years or until purpose fulfilled";
            case HEALTH_DATA:
                return "7 years minimum for medical records";
            case FINANCIAL_DATA:
                return "7 years for tax and audit purposes";
            case TECHNICAL_DATA:
                return "1 year for logs, indefinite for credentials";
            default:
                return "3 years standard retention";
        }
    }

    private List<String> geoRestrictions(List<ComplianceFlag> flags) {
        List<String> restrictions = new ArrayList<>();
        if (hasFramework(flags, "GDPR")) {
            restrictions.add("Data must remain within EU/EEA");
        }
        if (hasFramework(flags, "CCPA")) {
            restrictions.add("California resident data handling requirements");
        }
        return restrictions;
    }

    private static boolean hasFramework(List<ComplianceFlag> flags, String framework) {
        return flags.stream().anyMatch(f -> framework.equals(f.getFramework()));
    }

    private static boolean anyPattern(List<PatternMatch> patterns, Set<String> types) {
        return patterns.stream().anyMatch(p -> types.contains(p.getType()));
    }

    private static void register(String name, List<DataCategory> categories, List<String> requirements) {
        FRAMEWORKS.put(name, new Framework(categories, requirements));
    }

    private static final class Framework {
        private final List<DataCategory> categories;
        private final List<String> requirements;

        private Framework(List<DataCategory> categories, List<String> requirements) {
            this.categories = categories;
            this.requirements = requirements;
        }
    }
}
