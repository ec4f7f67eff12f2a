package com.example.rpgcampaign;

import com.example.rpgcampaign.util.DiceFormula;
import com.example.rpgcampaign.util.Slugs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Slugs and DiceFormula Tests")
class SlugsTest {

    @ParameterizedTest
    @DisplayName("slugify lower-cases and dashes names")
    @CsvSource({
        "Marcus the Bold!, marcus-the-bold",
        "'  Captain   Mara ', captain-mara",
        "Old_Pete, old-pete",
        "--Goblin--, goblin",
        "'!!!', ''"
    })
    void slugify(String input, String expected) {
        assertEquals(expected, Slugs.slugify(input));
    }

    @Test
    @DisplayName("slugify treats null as empty")
    void slugifyNull() {
        assertEquals("", Slugs.slugify(null));
    }

    @ParameterizedTest
    @DisplayName("Valid dice formulas report their maximum")
    @CsvSource({
        "1d6, 6",
        "2d4+5, 13",
        "d20, 20",
        "3d8-2, 22",
        "20, 20",
        "2D6, 12"
    })
    void validFormulas(String formula, int max) {
        assertTrue(DiceFormula.isValid(formula));
        assertEquals(max, DiceFormula.maxValue(formula));
    }

    @ParameterizedTest
    @DisplayName("Malformed dice formulas are rejected")
    @ValueSource(strings = {"lots", "2d", "1d0", "d", "1d6+", "-3", ""})
    void invalidFormulas(String formula) {
        assertFalse(DiceFormula.isValid(formula));
        assertEquals(-1, DiceFormula.maxValue(formula));
    }
}
