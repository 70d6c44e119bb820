package com.compound.enrichment.lookup;

import com.compound.enrichment.core.model.QualityTier;

/**
 * SMILES quality predicate: a string with stereochemical markup (tetrahedral {@code @}
 * or double-bond {@code /} {@code \}) is complete, any other SMILES is flat.
 */
public class StereoChemistryPredicate implements QualityPredicate {

    @Override
    public QualityTier classify(String smiles) {
        if (smiles == null || smiles.isBlank()) {
            return QualityTier.UNRESOLVED;
        }
        return hasStereochemistry(smiles) ? QualityTier.FULL : QualityTier.DEGRADED;
    }

    public static boolean hasStereochemistry(String smiles) {
        return smiles.indexOf('@') >= 0 || smiles.indexOf('/') >= 0 || smiles.indexOf('\\') >= 0;
    }
}
