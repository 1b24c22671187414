package io.github.yok.vib.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.vib.core.basis.ModeParity;
import io.github.yok.vib.core.basis.ZeroOrderStateEnumerator;
import io.github.yok.vib.core.harmonic.HarmonicWeightTableCache;
import io.github.yok.vib.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vib.core.matrix.HamiltonianMatrices;
import io.github.yok.vib.core.matrix.TabulatedPerturbationMatrixBuilder;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.series.RsptSeriesGenerator;
import io.github.yok.vib.input.MolecularInputReader;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

public class VibrationalCalculatorTest {

    /**
     * サンプル入力（HDO）の最低エネルギーを 0 とした低い方の補正エネルギーです。
     */
    private static final double[] LOWEST_LEVELS =
            {0.0, 1435.5079071749306, 2771.388526913156, 2872.0190423587237, 3903.7824254789084};

    private VibrationalCalculator calculator;

    private double[] frequencies;

    private AnharmonicPotential potential;

    @BeforeEach
    public void setUp() {
        calculator = new VibrationalCalculator(new ZeroOrderStateEnumerator(),
                new TabulatedPerturbationMatrixBuilder(new HarmonicWeightTableCache(), 2),
                new VariationalSolver(new EjmlSymmetricEigenDecompositionBackend()),
                new RsptSeriesGenerator(40));
        MolecularInputReader reader = new MolecularInputReader();
        frequencies = reader.readFrequencies(new ClassPathResource("molecules/hdo/frequencies.txt"));
        potential = reader.readAnharmonicPotential(
                new ClassPathResource("molecules/hdo/anharmonic-coefficients.txt"));
    }

    private CalculationRequest.CalculationRequestBuilder request() {
        return CalculationRequest.builder().frequencies(frequencies).potential(potential)
                .energyCutoff(13000.0);
    }

    @Test
    public void testVariationalAndSeriesOnSampleMolecule() {
        CalculationResult result = calculator.calculate(request().rsptEnabled(true)
                .rsptTargetState(0).rsptOrder(12).build());

        assertEquals(23, result.getBasis().size());
        assertEquals(237047.225, HamiltonianMatrices.trace(result.getHamiltonian()), 1e-6);
        assertTrue(HamiltonianMatrices.isExactlySymmetric(result.getPerturbation()));

        double[] energies = result.getVariational().energies();
        Arrays.sort(energies);
        for (int i = 0; i < LOWEST_LEVELS.length; i++) {
            assertEquals(LOWEST_LEVELS[i], energies[i], 1e-6, "i=" + i);
        }
        assertEquals(4078.7073692802305, result.getVariational().getReferenceEnergy(), 1e-6);

        // 基底状態の摂動級数は変分計算の最低固有値に近づきます。
        assertTrue(result.hasSeries());
        assertEquals(76.975, result.getSeries().getCoefficients().get(0).doubleValue(), 1e-9);
        assertEquals(-83.00129218883977,
                result.getSeries().getCoefficients().get(1).doubleValue(), 1e-8);
        List<BigDecimal> sums = result.getSeries().partialSums();
        assertEquals(result.getVariational().getReferenceEnergy(),
                sums.get(sums.size() - 1).doubleValue(), 1e-3);
    }

    @Test
    public void testFrequencyShiftDoesNotChangeVariationalLevels() {
        CalculationResult plain = calculator.calculate(request().build());
        CalculationResult shifted = calculator
                .calculate(request().frequencyShifts(new double[] {-15.0, 8.0, -30.0}).build());

        double[] a = plain.getVariational().energies();
        double[] b = shifted.getVariational().energies();
        Arrays.sort(a);
        Arrays.sort(b);
        for (int i = 0; i < a.length; i++) {
            assertEquals(a[i], b[i], 1e-7, "i=" + i);
        }
        // シフト前の基底は残されます。
        assertNotSame(shifted.getUnshiftedBasis(), shifted.getBasis());
        assertEquals(plain.getBasis().get(0).getEnergy(),
                shifted.getUnshiftedBasis().get(0).getEnergy(), 0.0);
        assertFalse(shifted.hasSeries());
    }

    @Test
    public void testParityFilterRestrictsBasis() {
        CalculationResult result = calculator.calculate(request()
                .parities(List.of(ModeParity.ANY, ModeParity.ANY, ModeParity.ODD)).build());

        assertTrue(result.getBasis().size() > 0);
        for (int i = 0; i < result.getBasis().size(); i++) {
            assertEquals(1, result.getBasis().get(i).quantumNumber(2) % 2);
            assertEquals(i, result.getBasis().get(i).getIndex());
        }
    }

    @Test
    public void testVariationalCanBeDisabled() {
        CalculationResult result = calculator.calculate(request().variationalEnabled(false)
                .rsptEnabled(true).rsptOrder(3).build());
        assertFalse(result.hasVariational());
        assertEquals(3, result.getSeries().order());
    }

    @Test
    public void testRequestKeepsOwnCopiesOfArrays() {
        double[] freqs = frequencies.clone();
        double[] shifts = {-15.0, 8.0, -30.0};
        CalculationRequest req = CalculationRequest.builder().frequencies(freqs)
                .frequencyShifts(shifts).potential(potential).energyCutoff(13000.0).build();

        freqs[0] = 1.0;
        shifts[0] = 0.0;
        req.getFrequencies()[1] = 2.0;
        req.getFrequencyShifts()[1] = 0.0;

        assertArrayEquals(frequencies, req.getFrequencies(), 0.0);
        assertArrayEquals(new double[] {-15.0, 8.0, -30.0}, req.getFrequencyShifts(), 0.0);
        assertEquals(23, calculator.calculate(req).getBasis().size());
    }

    @Test
    public void testConfigurationErrors() {
        assertThrows(IllegalStateException.class,
                () -> calculator.calculate(request().energyCutoff(4000.0).build()));
        assertThrows(IllegalArgumentException.class, () -> calculator
                .calculate(request().frequencies(new double[] {2824.3, 1440.2}).build()));
        assertThrows(IllegalArgumentException.class, () -> calculator
                .calculate(request().parities(List.of(ModeParity.ODD)).build()));
        assertThrows(IllegalArgumentException.class, () -> calculator
                .calculate(request().frequencyShifts(new double[] {1.0}).build()));
        assertThrows(IllegalArgumentException.class, () -> calculator
                .calculate(request().rsptEnabled(true).rsptTargetState(23).build()));
    }
}
