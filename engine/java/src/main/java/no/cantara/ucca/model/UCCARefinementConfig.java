package no.cantara.ucca.model;

import no.cantara.ucca.constraint.ConstraintContext;

import java.util.List;

/**
 * Rules and switches for one refinement run.
 *
 * @param pruneEquivalent         whether callers hide refinements flagged as equivalent
 * @param includePartialAuthority tolerate assignments to controllers without a declared authority
 * @param maxCombinationsPerUCCA  upper bound on generated candidates for a single abstract UCCA
 * @param operatingContext        state that authority constraints and conditional groups are evaluated in
 */
public record UCCARefinementConfig(
        List<AuthorityRelationship> authorityRelationships,
        List<InterchangeableControllerGroup> interchangeableGroups,
        List<SpecialInteraction> specialInteractions,
        boolean pruneEquivalent,
        boolean includePartialAuthority,
        int maxCombinationsPerUCCA,
        GenerationMode generationMode,
        GroupOverlapPolicy groupOverlapPolicy,
        ConstraintContext operatingContext
) {
    public static final int DEFAULT_MAX_COMBINATIONS = 10_000;

    public UCCARefinementConfig {
        authorityRelationships = authorityRelationships != null ? List.copyOf(authorityRelationships) : List.of();
        interchangeableGroups = interchangeableGroups != null ? List.copyOf(interchangeableGroups) : List.of();
        specialInteractions = specialInteractions != null ? List.copyOf(specialInteractions) : List.of();
        generationMode = generationMode != null ? generationMode : GenerationMode.FULL;
        groupOverlapPolicy = groupOverlapPolicy != null ? groupOverlapPolicy : GroupOverlapPolicy.WARN;
        operatingContext = operatingContext != null ? operatingContext : ConstraintContext.UNCONSTRAINED;
    }

    public UCCARefinementConfig(List<AuthorityRelationship> authorityRelationships,
                                List<InterchangeableControllerGroup> interchangeableGroups,
                                List<SpecialInteraction> specialInteractions,
                                boolean pruneEquivalent,
                                boolean includePartialAuthority) {
        this(authorityRelationships, interchangeableGroups, specialInteractions, pruneEquivalent,
                includePartialAuthority, DEFAULT_MAX_COMBINATIONS, GenerationMode.FULL, GroupOverlapPolicy.WARN,
                ConstraintContext.UNCONSTRAINED);
    }

    public UCCARefinementConfig withMaxCombinations(int max) {
        return new UCCARefinementConfig(authorityRelationships, interchangeableGroups, specialInteractions,
                pruneEquivalent, includePartialAuthority, max, generationMode, groupOverlapPolicy, operatingContext);
    }

    public UCCARefinementConfig withGenerationMode(GenerationMode mode) {
        return new UCCARefinementConfig(authorityRelationships, interchangeableGroups, specialInteractions,
                pruneEquivalent, includePartialAuthority, maxCombinationsPerUCCA, mode, groupOverlapPolicy,
                operatingContext);
    }

    public UCCARefinementConfig withOperatingContext(ConstraintContext context) {
        return new UCCARefinementConfig(authorityRelationships, interchangeableGroups, specialInteractions,
                pruneEquivalent, includePartialAuthority, maxCombinationsPerUCCA, generationMode, groupOverlapPolicy,
                context);
    }
}
