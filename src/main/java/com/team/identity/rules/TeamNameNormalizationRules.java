package com.team.identity.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * The hand-maintained rule table for football team names.
 *
 * <p>Order: diacritic folding, ampersand expansion, club affixes, then abbreviations.
 * Folding runs first so an accented spelling of an affix ("FÇ") is removed in the same pass.</p>
 */
public final class TeamNameNormalizationRules {

    private TeamNameNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the full team rule table.
     */
    public static NormalizationEngine createTeamEngine() {
        return new NormalizationEngine(getAllRules());
    }

    /**
     * Gets the complete rule table in application order.
     */
    public static List<NormalizationRule> getAllRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getDiacriticRules());
        rules.addAll(getPunctuationRules());
        rules.addAll(getAffixRules());
        rules.addAll(getAbbreviationRules());
        return rules;
    }

    /**
     * Folds accented Latin letters to their ASCII base letter.
     */
    public static List<NormalizationRule> getDiacriticRules() {
        return List.of(
                NormalizationRule.of("fold-a", "[áàâãäå]", "a"),
                NormalizationRule.of("fold-e", "[éèêë]", "e"),
                NormalizationRule.of("fold-i", "[íìîï]", "i"),
                NormalizationRule.of("fold-o", "[óòôõöø]", "o"),
                NormalizationRule.of("fold-u", "[úùûü]", "u"),
                NormalizationRule.of("fold-c", "ç", "c"),
                NormalizationRule.of("fold-n", "ñ", "n"),
                NormalizationRule.of("fold-sharp-s", "ß", "ss")
        );
    }

    /**
     * "Brighton & Hove Albion" and "Brighton and Hove Albion" share a key.
     */
    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                NormalizationRule.of("ampersand", "\\s*&\\s*", " and ")
        );
    }

    /**
     * Club-form prefixes and suffixes that providers add or drop at will.
     */
    public static List<NormalizationRule> getAffixRules() {
        return List.of(
                NormalizationRule.of("affix-fc", "\\bFC\\b", ""),
                NormalizationRule.of("affix-cf", "\\bCF\\b", ""),
                NormalizationRule.of("affix-ac", "\\bAC\\b", ""),
                NormalizationRule.of("affix-sc", "\\bSC\\b", ""),
                NormalizationRule.of("affix-asc", "\\bASC\\b", ""),
                NormalizationRule.of("affix-club", "\\bClub\\b", ""),
                NormalizationRule.of("affix-olympique", "\\bOlympique\\b", ""),
                NormalizationRule.of("affix-sporting", "\\bSporting\\b", ""),
                NormalizationRule.of("affix-hotspur", "\\bHotspur\\b", "")
        );
    }

    /**
     * Abbreviations the odds provider prefers.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        return List.of(
                NormalizationRule.of("abbrev-united", "\\bUnited\\b", "Utd")
        );
    }
}
