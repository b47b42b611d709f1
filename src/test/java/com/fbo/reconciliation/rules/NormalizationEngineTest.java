package com.fbo.reconciliation.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = FacilityNameRules.createDefaultEngine();
    }

    @ParameterizedTest
    @CsvSource({
            "Signature Aviation, signature",
            "Signature FBO, signature",
            "'  Atlantic   Aviation  FBO ', atlantic",
            "Million Air, million air",
            "'Jet Aviation', jet",
            "SIGNATURE, signature"
    })
    @DisplayName("Should strip generic tokens and collapse whitespace")
    void testNormalize(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    @DisplayName("Should return empty key for null or blank input")
    void testBlankInput(String input) {
        assertEquals("", engine.normalize(input));
    }

    @Test
    @DisplayName("Should match tokens anywhere in the name, not only whole words")
    void testSubstringRemoval() {
        assertEquals("skyaero", engine.normalize("SkyFBOAero"));
    }

    @Test
    @DisplayName("Should re-apply rules when a removal exposes a new match")
    void testIdempotentOnNestedTokens() {
        String once = engine.normalize("fbaviationo west");
        assertEquals("west", once);
        assertEquals(once, engine.normalize(once));
    }

    @Test
    @DisplayName("Should reach a fixed point however deeply tokens are nested")
    void testDeeplyNestedTokens() {
        String nested = "avi".repeat(20) + "ation".repeat(20) + " east";

        String once = engine.normalize(nested);

        assertEquals("east", once);
        assertEquals(once, engine.normalize(once));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Signature Aviation", "Ross FBO Aviation", "Aviation", "Wilson Air Center"})
    @DisplayName("Normalization should be idempotent")
    void testIdempotent(String name) {
        String key = engine.normalize(name);
        assertEquals(key, engine.normalize(key));
    }

    @Test
    @DisplayName("Should treat spelling variants as equivalent")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("Signature Aviation", "signature fbo"));
        assertFalse(engine.areEquivalent("Signature Aviation", "Atlantic Aviation"));
    }

    @Test
    @DisplayName("Should apply custom rules in priority order")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("ampersand").pattern("&").replacement(" and ").priority(5).build());
        custom.addRules(FacilityNameRules.getGenericTokenRules());

        assertEquals("jones and sons", custom.normalize("Jones & Sons Aviation"));
        assertEquals(3, custom.getRules().size());
        assertEquals("ampersand", custom.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Should remove rules by name")
    void testRemoveRule() {
        assertTrue(engine.removeRule("generic-fbo"));
        assertEquals("signature fbo", engine.normalize("Signature FBO"));
        assertFalse(engine.removeRule("missing"));
    }
}
