package io.github.yok.vib.core.potential;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class AnharmonicPotentialTest {

    @Test
    public void testMaxPowerAndTermsBeyondMaxOrder() {
        AnharmonicTerm cubic = AnharmonicTerm.of(-258.4, 3, 0, 0);
        AnharmonicTerm ninth = AnharmonicTerm.of(1.0, 0, 9, 0);
        AnharmonicPotential potential = new AnharmonicPotential(3, List.of(cubic, ninth));

        assertEquals(2, potential.size());
        assertEquals(9, potential.maxPower());
        assertEquals(List.of(ninth), potential.termsBeyondMaxOrder());
    }

    @Test
    public void testTermCopiesPowers() {
        int[] powers = {1, 1, 1};
        AnharmonicTerm term = new AnharmonicTerm(powers, -15.4);
        powers[0] = 7;
        assertArrayEquals(new int[] {1, 1, 1}, term.powers());
        assertEquals(3, term.modeCount());
        assertEquals(-15.4, term.coefficient(), 0.0);
    }

    @Test
    public void testRejectsInvalidTerms() {
        assertThrows(IllegalArgumentException.class, () -> AnharmonicTerm.of(1.0, 1, -1));
        assertThrows(IllegalArgumentException.class, () -> AnharmonicTerm.of(Double.NaN, 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new AnharmonicPotential(2, List.of(AnharmonicTerm.of(1.0, 1, 1, 1))));
        assertThrows(IllegalArgumentException.class,
                () -> new AnharmonicPotential(2, Arrays.asList(AnharmonicTerm.of(1.0, 1, 1), null)));
    }
}
