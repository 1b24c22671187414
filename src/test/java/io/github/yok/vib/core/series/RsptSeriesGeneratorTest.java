package io.github.yok.vib.core.series;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderState;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

public class RsptSeriesGeneratorTest {

    /**
     * H = diag(0, 1, 2.5) + W の最低固有値です。
     */
    private static final double EXACT_LOWEST = 0.039193461759680526;

    private static ZeroOrderBasis basis(double... energies) {
        ZeroOrderState[] states = new ZeroOrderState[energies.length];
        for (int v = 0; v < energies.length; v++) {
            states[v] = new ZeroOrderState(0, new int[] {v}, energies[v]);
        }
        return ZeroOrderBasis.sortedOf(1, List.of(states));
    }

    private static DMatrixRMaj perturbation() {
        return new DMatrixRMaj(
                new double[][] {{0.05, 0.1, 0.02}, {0.1, -0.03, 0.07}, {0.02, 0.07, 0.01}});
    }

    @Test
    public void testLowOrderCoefficients() {
        RsptSeries series = new RsptSeriesGenerator().series(0, basis(0.0, 1.0, 2.5),
                perturbation(), 6);

        double[] e = series.coefficientsAsDouble();
        assertEquals(6, series.order());
        assertEquals(0.05, e[0], 1e-17);
        // e_1 = Σ W_qi² / (E_q - E_i)
        assertEquals(-0.01 - 0.0004 / 2.5, e[1], 1e-16);
        assertEquals(-0.00069056, e[2], 1e-16);
        assertEquals(2.904768e-05, e[3], 1e-17);
        assertEquals(1.413648896e-05, e[4], 1e-17);
        assertEquals(1.08493190656e-06, e[5], 1e-18);
        assertEquals(0, series.getTargetIndex());
        assertArrayEquals(new int[] {0}, series.getQuantumNumbers());
        assertEquals(0.0, series.getZeroOrderEnergy(), 0.0);
    }

    @Test
    public void testPartialSumsConvergeToLowestEigenvalue() {
        RsptSeries series = new RsptSeriesGenerator().series(0, basis(0.0, 1.0, 2.5),
                perturbation(), 40);

        List<BigDecimal> sums = series.partialSums();
        assertEquals(40, sums.size());
        assertEquals(EXACT_LOWEST, sums.get(39).doubleValue(), 1e-14);

        // 部分和は E(0) + Σ e_k
        BigDecimal manual = BigDecimal.ZERO;
        for (int k = 0; k < 3; k++) {
            manual = manual.add(series.getCoefficients().get(k));
        }
        assertEquals(manual.doubleValue(), sums.get(2).doubleValue(), 1e-18);
    }

    @Test
    public void testSeriesDoesNotExposeInternalState() {
        RsptSeries series = new RsptSeriesGenerator().series(0, basis(0.0, 1.0, 2.5),
                perturbation(), 3);

        series.getQuantumNumbers()[0] = 7;
        assertArrayEquals(new int[] {0}, series.getQuantumNumbers());
        assertThrows(UnsupportedOperationException.class,
                () -> series.getCoefficients().set(0, BigDecimal.ONE));

        int[] quanta = {2};
        List<BigDecimal> coefficients = new ArrayList<>(List.of(BigDecimal.ONE));
        RsptSeries copied = new RsptSeries(0, quanta, 0.0, coefficients, 20);
        quanta[0] = 5;
        coefficients.add(BigDecimal.TEN);
        assertArrayEquals(new int[] {2}, copied.getQuantumNumbers());
        assertEquals(1, copied.order());
    }

    @Test
    public void testExcitedTargetUsesItsOwnReference() {
        RsptSeries series = new RsptSeriesGenerator(30).series(1, basis(0.0, 1.0, 2.5),
                perturbation(), 4);
        double[] e = series.coefficientsAsDouble();

        assertEquals(1.0, series.getZeroOrderEnergy(), 0.0);
        assertEquals(-0.03, e[0], 1e-17);
        // W_10² / (1 - 0) + W_12² / (1 - 2.5)
        assertEquals(0.01 - 0.0049 / 1.5, e[1], 1e-16);
        assertEquals(30, series.getPrecisionDigits());
    }

    @Test
    public void testPrecisionDoesNotChangeLeadingDigits() {
        double[] high = new RsptSeriesGenerator(60).series(0, basis(0.0, 1.0, 2.5),
                perturbation(), 15).coefficientsAsDouble();
        double[] low = new RsptSeriesGenerator(25).series(0, basis(0.0, 1.0, 2.5),
                perturbation(), 15).coefficientsAsDouble();
        for (int k = 0; k < high.length; k++) {
            assertEquals(high[k], low[k], Math.abs(high[k]) * 1e-15 + 1e-30, "k=" + k);
        }
    }

    @Test
    public void testExactDegeneracyIsRejected() {
        assertThrows(IllegalStateException.class, () -> new RsptSeriesGenerator()
                .series(0, basis(1.0, 1.0, 2.5), perturbation(), 4));
    }

    @Test
    public void testRejectsInvalidArguments() {
        RsptSeriesGenerator generator = new RsptSeriesGenerator();
        ZeroOrderBasis basis = basis(0.0, 1.0, 2.5);
        assertThrows(IllegalArgumentException.class,
                () -> generator.series(0, basis, perturbation(), 1));
        assertThrows(IllegalArgumentException.class,
                () -> generator.series(3, basis, perturbation(), 4));
        assertThrows(IllegalArgumentException.class,
                () -> generator.series(-1, basis, perturbation(), 4));
        assertThrows(IllegalArgumentException.class,
                () -> generator.series(0, basis, new DMatrixRMaj(2, 2), 4));
        assertThrows(IllegalArgumentException.class, () -> new RsptSeriesGenerator(0));
    }
}
