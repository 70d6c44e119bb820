package com.compound.enrichment.lookup;

import com.compound.enrichment.core.model.QualityTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StereoChemistryPredicateTest {

    private final StereoChemistryPredicate predicate = new StereoChemistryPredicate();

    @ParameterizedTest
    @ValueSource(strings = {"C[C@H](N)C(=O)O", "C/C=C/C", "C\\C=C\\C", "C[C@@H]1CCCO1"})
    @DisplayName("Should classify SMILES with stereo markup as FULL")
    void testStereo(String smiles) {
        assertEquals(QualityTier.FULL, predicate.classify(smiles));
    }

    @Test
    @DisplayName("Should classify flat SMILES as DEGRADED")
    void testFlat() {
        assertEquals(QualityTier.DEGRADED, predicate.classify("CC(N)C(=O)O"));
    }

    @Test
    @DisplayName("Should classify blank values as UNRESOLVED")
    void testBlank() {
        assertEquals(QualityTier.UNRESOLVED, predicate.classify(""));
        assertEquals(QualityTier.UNRESOLVED, predicate.classify(null));
        assertEquals(QualityTier.UNRESOLVED, QualityPredicate.ANY_VALUE_IS_FULL.classify(" "));
    }
}
