package io.github.yok.vib.core.matrix;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderStateEnumerator;
import io.github.yok.vib.core.harmonic.HarmonicWeightTableCache;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.potential.AnharmonicTerm;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

public class PerturbationMatrixBuilderTest {

    private final ZeroOrderStateEnumerator enumerator = new ZeroOrderStateEnumerator();

    private final HarmonicWeightTableCache cache = new HarmonicWeightTableCache();

    private static AnharmonicPotential mixedPotential() {
        return new AnharmonicPotential(3,
                List.of(AnharmonicTerm.of(-258.4, 3, 0, 0), AnharmonicTerm.of(-15.4, 1, 1, 1),
                        AnharmonicTerm.of(62.0, 0, 0, 4), AnharmonicTerm.of(4.1, 3, 1, 0),
                        AnharmonicTerm.of(-0.7, 2, 2, 2), AnharmonicTerm.of(0.03, 0, 5, 1),
                        AnharmonicTerm.of(1.0e-3, 8, 0, 0), AnharmonicTerm.of(2.0e-4, 0, 7, 1)));
    }

    @Test
    public void testSingleModeQuadraticTerm() {
        ZeroOrderBasis basis = enumerator.enumerate(4.5, new double[] {1.0});
        AnharmonicPotential potential =
                new AnharmonicPotential(1, List.of(AnharmonicTerm.of(2.0, 2)));

        DMatrixRMaj w = new TabulatedPerturbationMatrixBuilder(cache, 1).build(potential, basis);

        assertEquals(5, w.numRows);
        assertEquals(1.0, w.get(0, 0), 1e-15);
        assertEquals(3.0, w.get(1, 1), 1e-15);
        assertEquals(2.0 * 0.5 * Math.sqrt(2.0), w.get(0, 2), 1e-15);
        assertEquals(w.get(0, 2), w.get(2, 0), 0.0);
        // 偶奇の異なる組は 0
        assertEquals(0.0, w.get(0, 1), 0.0);
        assertEquals(0.0, w.get(0, 3), 0.0);
        // dv > n は 0
        assertEquals(0.0, w.get(0, 4), 0.0);
    }

    @Test
    public void testTwoModeBilinearCoupling() {
        ZeroOrderBasis basis = enumerator.enumerate(4.0, new double[] {1.0, 1.5});
        AnharmonicPotential potential =
                new AnharmonicPotential(2, List.of(AnharmonicTerm.of(3.0, 1, 1)));

        DMatrixRMaj w = new TabulatedPerturbationMatrixBuilder(cache, 1).build(potential, basis);

        int i00 = basis.indexOf(0, 0);
        int i11 = basis.indexOf(1, 1);
        int i10 = basis.indexOf(1, 0);
        assertTrue(i00 >= 0 && i11 >= 0 && i10 >= 0);
        assertEquals(1.5, w.get(i00, i11), 1e-12);
        assertEquals(0.0, w.get(i00, i00), 0.0);
        assertEquals(0.0, w.get(i00, i10), 0.0);
    }

    @Test
    public void testTabulatedAndClosedFormAgreeExactly() {
        ZeroOrderBasis basis = enumerator.enumerate(9.0, new double[] {1.0, 1.7, 2.3});
        AnharmonicPotential potential = mixedPotential();

        DMatrixRMaj tabulated =
                new TabulatedPerturbationMatrixBuilder(cache, 1).build(potential, basis);
        DMatrixRMaj closedForm = new ClosedFormPerturbationMatrixBuilder().build(potential, basis);

        assertArrayEquals(closedForm.data, tabulated.data, 0.0);
        assertTrue(HamiltonianMatrices.isExactlySymmetric(tabulated));
        assertTrue(HamiltonianMatrices.isExactlySymmetric(closedForm));
        assertTrue(TabulatedPerturbationMatrixBuilder.countNonZero(tabulated) > basis.size());
    }

    @Test
    public void testParallelAssemblyMatchesSequential() {
        ZeroOrderBasis basis = enumerator.enumerate(10.0, new double[] {1.0, 1.7, 2.3});
        AnharmonicPotential potential = mixedPotential();

        DMatrixRMaj sequential =
                new TabulatedPerturbationMatrixBuilder(cache, 1).build(potential, basis);
        DMatrixRMaj parallel =
                new TabulatedPerturbationMatrixBuilder(cache, 4).build(potential, basis);

        assertArrayEquals(sequential.data, parallel.data, 0.0);
    }

    @Test
    public void testTermsAboveOrderEightContributeNothing() {
        ZeroOrderBasis basis = enumerator.enumerate(12.5, new double[] {1.0});
        AnharmonicPotential plain =
                new AnharmonicPotential(1, List.of(AnharmonicTerm.of(0.5, 4)));
        AnharmonicPotential withNinth = new AnharmonicPotential(1,
                List.of(AnharmonicTerm.of(0.5, 4), AnharmonicTerm.of(100.0, 9)));

        PerturbationMatrixBuilder builder = new TabulatedPerturbationMatrixBuilder(cache, 1);
        assertArrayEquals(builder.build(plain, basis).data, builder.build(withNinth, basis).data,
                0.0);
        assertArrayEquals(new ClosedFormPerturbationMatrixBuilder().build(plain, basis).data,
                new ClosedFormPerturbationMatrixBuilder().build(withNinth, basis).data, 0.0);
    }

    @Test
    public void testEmptyBasisAndModeMismatchAreRejected() {
        ZeroOrderBasis empty = enumerator.enumerate(0.1, new double[] {1.0});
        AnharmonicPotential oneMode =
                new AnharmonicPotential(1, List.of(AnharmonicTerm.of(1.0, 3)));
        PerturbationMatrixBuilder builder = new TabulatedPerturbationMatrixBuilder(cache, 1);

        assertThrows(IllegalStateException.class, () -> builder.build(oneMode, empty));

        ZeroOrderBasis twoModes = enumerator.enumerate(5.0, new double[] {1.0, 2.0});
        assertThrows(IllegalArgumentException.class, () -> builder.build(oneMode, twoModes));
        assertThrows(IllegalArgumentException.class,
                () -> new ClosedFormPerturbationMatrixBuilder().build(oneMode, twoModes));
    }

    @Test
    public void testCancellation() {
        ZeroOrderBasis basis = enumerator.enumerate(9.0, new double[] {1.0, 1.7, 2.3});
        AnharmonicPotential potential = mixedPotential();

        assertThrows(CancellationException.class,
                () -> new TabulatedPerturbationMatrixBuilder(cache, 1, () -> true)
                        .build(potential, basis));
        assertThrows(CancellationException.class,
                () -> new TabulatedPerturbationMatrixBuilder(cache, 3, () -> true)
                        .build(potential, basis));
    }

    @Test
    public void testRejectsInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new TabulatedPerturbationMatrixBuilder(cache, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new TabulatedPerturbationMatrixBuilder(null, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new TabulatedPerturbationMatrixBuilder(cache, 1, null));
    }
}
