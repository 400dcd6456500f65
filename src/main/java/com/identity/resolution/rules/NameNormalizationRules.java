package com.identity.resolution.rules;

import com.identity.resolution.core.model.ParseType;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in normalization rules for person, household and organization names.
 */
public final class NameNormalizationRules {

    private NameNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all built-in rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getOrganizationRules());
        engine.addRules(getPersonRules());
        engine.addRules(getHouseholdRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Legal-form designators and a leading article are not identity-bearing for organizations.
     */
    public static List<NormalizationRule> getOrganizationRules() {
        Stream<NormalizationRule> designators = Stream.of(
                designator("inc", "Inc\\.?|Incorporated"),
                designator("ltd", "Ltd\\.?|Limited"),
                designator("corp", "Corp\\.?|Corporation"),
                designator("co", "Co\\.?|Company"),
                designator("llc", "LLC|L\\.L\\.C\\."),
                designator("plc", "PLC|P\\.L\\.C\\."));
        Stream<NormalizationRule> article = Stream.of(
                NormalizationRule.scoped("org-the", "^The\\s+", "", 20, ParseType.ORGANIZATION));
        return Stream.concat(designators, article).collect(Collectors.toList());
    }

    /**
     * Honorifics and generational suffixes left in a person string after parsing.
     * Unknown types get them too, since single-token and unparsed names still carry titles.
     */
    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.scoped("person-title",
                        "^(Mr|Mrs|Ms|Miss|Dr|Prof|Sir|Dame|Lady|Lord)\\.?\\s+", "", 10,
                        ParseType.PERSON, ParseType.UNKNOWN),
                NormalizationRule.scoped("person-generational",
                        ",?\\s+(Jr\\.?|Junior|Sr\\.?|Senior|II|III|IV)$", "", 10,
                        ParseType.PERSON, ParseType.UNKNOWN));
    }

    /**
     * Conjunctions joining household members compare as whitespace.
     */
    public static List<NormalizationRule> getHouseholdRules() {
        return List.of(
                NormalizationRule.scoped("household-and", "\\s+and\\s+", " ", 50, ParseType.HOUSEHOLD),
                NormalizationRule.scoped("household-ampersand", "\\s*&\\s*", " ", 50, ParseType.HOUSEHOLD));
    }

    /**
     * Rules that apply to every type.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // O'Brien -> obrien
                NormalizationRule.common("common-apostrophe", "['’`]", "", 90),
                NormalizationRule.common("common-special-chars", "[^\\p{L}\\p{N}\\s]", " ", 100),
                NormalizationRule.common("common-collapse-spaces", "\\s+", " ", 200));
    }

    /**
     * A trailing legal-form designator, optionally preceded by a comma.
     */
    private static NormalizationRule designator(String suffix, String alternatives) {
        return NormalizationRule.scoped("org-" + suffix, ",?\\s*\\b(" + alternatives + ")$", "", 10,
                ParseType.ORGANIZATION);
    }
}
