package io.github.yok.vib.core.solver;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderState;
import io.github.yok.vib.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vib.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * ハミルトニアン行列 H を対角化し、各固有状態にゼロ次状態のラベルを割り当てるクラスです（変分計算）。
 *
 * <p>
 * 固有ベクトル k とゼロ次状態 b の重なり {@code |c_{bk}|²} が大きい組から順に、 まだ割り当てのない固有ベクトルと基底番号を 1 対 1
 * で結びます（貪欲法）。 重なりが同値の場合は固有値の番号が小さい方、さらに基底番号が小さい方を優先します。 強く混ざった状態で複数の固有ベクトルが同じ基底番号を
 * 最大の重なりとする場合でも、結果は必ず置換になり、同じ入力に対して同じ割り当てを返します。
 * </p>
 *
 * <p>
 * 結果は割り当てた基底番号の順に並び、エネルギーは基準エネルギー E0 からの相対値です。
 * </p>
 */
@Slf4j
public final class VariationalSolver {

    /**
     * 固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * ソルバを生成します。
     *
     * @param eigenBackend 固有分解バックエンドです（null 不可）
     * @throws IllegalArgumentException eigenBackend が null の場合に発生します
     */
    public VariationalSolver(EigenDecompositionBackend eigenBackend) {
        if (eigenBackend == null) {
            throw new IllegalArgumentException("eigenBackend は null 不可です");
        }
        this.eigenBackend = eigenBackend;
    }

    /**
     * 最低固有値を基準エネルギーとして対角化します。
     *
     * @param hamiltonian ハミルトニアン行列 H です（N×N、実対称）
     * @param basis ゼロ次基底です（状態数 N）
     * @return 変分計算の結果です
     */
    public VariationalResult diagonalize(DMatrixRMaj hamiltonian, ZeroOrderBasis basis) {
        return solve(hamiltonian, basis, Double.NaN);
    }

    /**
     * 指定の基準エネルギーで対角化します。
     *
     * @param hamiltonian ハミルトニアン行列 H です（N×N、実対称）
     * @param basis ゼロ次基底です（状態数 N）
     * @param referenceEnergy 基準エネルギー E0 です（有限値）
     * @return 変分計算の結果です
     * @throws IllegalArgumentException referenceEnergy が有限値でない場合に発生します
     */
    public VariationalResult diagonalize(DMatrixRMaj hamiltonian, ZeroOrderBasis basis,
            double referenceEnergy) {
        if (!Double.isFinite(referenceEnergy)) {
            throw new IllegalArgumentException("referenceEnergy は有限値が必要です: " + referenceEnergy);
        }
        return solve(hamiltonian, basis, referenceEnergy);
    }

    private VariationalResult solve(DMatrixRMaj hamiltonian, ZeroOrderBasis basis,
            double referenceEnergy) {
        if (hamiltonian == null) {
            throw new IllegalArgumentException("hamiltonian は null 不可です");
        }
        if (basis == null) {
            throw new IllegalArgumentException("basis は null 不可です");
        }
        if (basis.isEmpty()) {
            throw new IllegalStateException("基底が空です");
        }
        int n = basis.size();
        if (hamiltonian.numRows != n || hamiltonian.numCols != n) {
            throw new IllegalArgumentException("行列の次元と基底の状態数が一致しません: " + hamiltonian.numRows + "x"
                    + hamiltonian.numCols + " vs " + n);
        }

        EigenDecompositionResult eigen = eigenBackend.decomposeSymmetricAndSort(hamiltonian);
        double[] eigenvalues = eigen.getEigenvalues();
        DMatrixRMaj vectors = eigen.getEigenvectors();

        // 基準エネルギー（未指定なら最低固有値）
        double e0 = Double.isNaN(referenceEnergy) ? eigenvalues[0] : referenceEnergy;

        Assignment assignment = assignByOverlap(vectors);
        if (assignment.contested > 0) {
            log.warn("重なり最大のゼロ次状態が他の固有ベクトルと重複したため、{} 個の固有ベクトルを次点の状態に割り当てました", assignment.contested);
        }

        List<VibState> states = new ArrayList<>(n);
        DMatrixRMaj reordered = new DMatrixRMaj(n, n);
        for (int b = 0; b < n; b++) {
            int k = assignment.eigenOfBasis[b];
            ZeroOrderState label = basis.get(b);
            double c = vectors.unsafe_get(b, k);
            states.add(new VibState(b, label.quantumNumbers(), eigenvalues[k] - e0,
                    label.getEnergy(), c * c, k));
            for (int row = 0; row < n; row++) {
                reordered.unsafe_set(row, b, vectors.unsafe_get(row, k));
            }
        }

        log.info("変分計算が完了しました。N={}、基準エネルギーE0={}、最低補正エネルギー={}", n, e0, eigenvalues[0] - e0);
        return new VariationalResult(Collections.unmodifiableList(states), reordered, e0,
                assignment.contested);
    }

    /**
     * 重なりの大きい組から貪欲に、固有ベクトルと基底番号を 1 対 1 で割り当てます。
     *
     * <p>
     * 各固有ベクトルの「未割り当ての基底番号の中で最大の重なり」を優先度付きキューに入れ、 取り出した候補の基底番号が既に埋まっていれば
     * 次点を計算し直して戻します。 重なりは再計算のたびに小さくなる一方なので、取り出し順は全組の重なり降順と一致します。
     * </p>
     *
     * @param vectors 固有ベクトル行列です（列が固有ベクトル）
     * @return 割り当て結果です
     */
    static Assignment assignByOverlap(DMatrixRMaj vectors) {
        int n = vectors.numCols;
        boolean[] claimed = new boolean[vectors.numRows];
        int[] eigenOfBasis = new int[vectors.numRows];
        boolean[] displaced = new boolean[n];
        int contested = 0;

        PriorityQueue<Candidate> queue = new PriorityQueue<>(Math.max(1, n),
                Comparator.comparingDouble((Candidate c) -> -c.overlap)
                        .thenComparingInt(c -> c.eigen).thenComparingInt(c -> c.basis));
        for (int k = 0; k < n; k++) {
            queue.add(bestUnclaimed(vectors, k, claimed));
        }

        while (!queue.isEmpty()) {
            Candidate c = queue.poll();
            if (claimed[c.basis]) {
                if (!displaced[c.eigen]) {
                    displaced[c.eigen] = true;
                    contested++;
                }
                queue.add(bestUnclaimed(vectors, c.eigen, claimed));
                continue;
            }
            claimed[c.basis] = true;
            eigenOfBasis[c.basis] = c.eigen;
        }
        return new Assignment(eigenOfBasis, contested);
    }

    private static Candidate bestUnclaimed(DMatrixRMaj vectors, int eigen, boolean[] claimed) {
        int best = -1;
        double bestOverlap = -1.0;
        for (int b = 0; b < vectors.numRows; b++) {
            if (claimed[b]) {
                continue;
            }
            double c = vectors.unsafe_get(b, eigen);
            double overlap = c * c;
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                best = b;
            }
        }
        if (best < 0) {
            throw new IllegalStateException("割り当て可能なゼロ次状態がありません: eigen=" + eigen);
        }
        return new Candidate(eigen, best, bestOverlap);
    }

    /**
     * 割り当て候補（固有ベクトル, 基底番号, 重なり）です。
     */
    @Value
    private static class Candidate {

        int eigen;

        int basis;

        double overlap;
    }

    /**
     * 割り当て結果です。
     */
    @Value
    static class Assignment {

        /**
         * 基底番号ごとに割り当てた固有値の番号です。
         */
        int[] eigenOfBasis;

        /**
         * 最大重なりの基底番号を他に取られた固有ベクトルの数です。
         */
        int contested;
    }

    /**
     * 変分計算の結果を表すクラスです。
     */
    @Value
    public static class VariationalResult {

        /**
         * 補正後の振動状態です（割り当てた基底番号の順）。
         */
        List<VibState> states;

        /**
         * 固有ベクトル行列です（列 i が states の i 番目に対応します）。
         */
        DMatrixRMaj eigenvectors;

        /**
         * 使用した基準エネルギー E0 です。
         */
        double referenceEnergy;

        /**
         * 最大重なりの基底番号を他に取られた固有ベクトルの数です。
         */
        int contestedAssignments;

        /**
         * 相対エネルギーの配列を返します。
         *
         * @return エネルギー配列です
         */
        public double[] energies() {
            double[] e = new double[states.size()];
            for (int i = 0; i < e.length; i++) {
                e[i] = states.get(i).getEnergy();
            }
            return e;
        }
    }
}
