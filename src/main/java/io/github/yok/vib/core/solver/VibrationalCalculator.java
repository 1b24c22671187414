package io.github.yok.vib.core.solver;

import io.github.yok.vib.core.basis.ModeParity;
import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderStateEnumerator;
import io.github.yok.vib.core.matrix.HamiltonianMatrices;
import io.github.yok.vib.core.matrix.PerturbationMatrixBuilder;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.series.RsptSeries;
import io.github.yok.vib.core.series.RsptSeriesGenerator;
import io.github.yok.vib.core.solver.VariationalSolver.VariationalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 振動エネルギー計算の一連の手順をまとめて実行するクラスです。
 *
 * <p>
 * 手順は次のとおりです。
 * </p>
 * <ol>
 * <li>ゼロ次状態の列挙（零点エネルギーから Emax まで）</li>
 * <li>偶奇条件による基底の選別（任意）</li>
 * <li>摂動行列 W の組み立て</li>
 * <li>周波数シフト（任意）</li>
 * <li>H = W + diag(E) の対角化（任意）</li>
 * <li>摂動級数の生成（任意）</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public final class VibrationalCalculator {

    /**
     * ゼロ次状態の列挙ロジックです。
     */
    private final ZeroOrderStateEnumerator enumerator;

    /**
     * 摂動行列の組み立てロジックです。
     */
    private final PerturbationMatrixBuilder matrixBuilder;

    /**
     * 変分計算ロジックです。
     */
    private final VariationalSolver variationalSolver;

    /**
     * 摂動級数の生成ロジックです。
     */
    private final RsptSeriesGenerator seriesGenerator;

    /**
     * 計算を実行します。
     *
     * @param request 計算の入力です
     * @return 計算結果です
     * @throws IllegalArgumentException 入力が不正な場合、またはモード数が一致しない場合に発生します
     * @throws IllegalStateException 基底が空の場合、または摂動級数の分母が 0 になる場合に発生します
     */
    public CalculationResult calculate(CalculationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request は null 不可です");
        }
        double[] frequencies = request.getFrequencies();
        AnharmonicPotential potential = request.getPotential();
        if (frequencies == null) {
            throw new IllegalArgumentException("frequencies は null 不可です");
        }
        if (potential == null) {
            throw new IllegalArgumentException("potential は null 不可です");
        }
        if (potential.getModeCount() != frequencies.length) {
            throw new IllegalArgumentException("振動数の数とポテンシャルのモード数が一致しません: "
                    + frequencies.length + " vs " + potential.getModeCount());
        }

        long tStart = System.nanoTime();

        // 1) 列挙
        long t0 = System.nanoTime();
        ZeroOrderBasis basis = enumerator.enumerate(request.getEnergyCutoff(), frequencies);
        log.info("[1/5] 列挙: 状態数={}、所要時間={}ms", basis.size(), elapsedMs(t0));

        // 2) 選別
        if (request.hasParityFilter()) {
            if (request.getParities().size() != frequencies.length) {
                throw new IllegalArgumentException("偶奇条件の長さがモード数と一致しません: "
                        + request.getParities().size() + " vs " + frequencies.length);
            }
            int before = basis.size();
            basis = basis.filter(ModeParity.filterOf(request.getParities()));
            log.info("[2/5] 偶奇選別: {} → {} 状態、条件={}", before, basis.size(),
                    request.getParities());
        }
        if (basis.isEmpty()) {
            throw new IllegalStateException("基底が空です。Emax=" + request.getEnergyCutoff()
                    + " が零点エネルギー未満か、偶奇条件を満たす状態がありません");
        }

        // 3) 組み立て
        t0 = System.nanoTime();
        DMatrixRMaj w = matrixBuilder.build(potential, basis);
        log.info("[3/5] 組み立て: N={}、所要時間={}ms", basis.size(), elapsedMs(t0));

        // 4) 周波数シフト
        ZeroOrderBasis unshifted = basis;
        if (request.hasFrequencyShifts()) {
            basis = basis.copy();
            HamiltonianMatrices.shiftFrequencies(request.getFrequencyShifts(), basis, w);
        }

        // 5) 対角化
        DMatrixRMaj h = HamiltonianMatrices.addZeroOrderEnergies(w, basis);
        VariationalResult variational = null;
        if (request.isVariationalEnabled()) {
            t0 = System.nanoTime();
            Double e0 = request.getReferenceEnergy();
            variational = (e0 == null) ? variationalSolver.diagonalize(h, basis)
                    : variationalSolver.diagonalize(h, basis, e0);
            log.info("[4/5] 対角化: N={}、E0={}、所要時間={}ms", basis.size(),
                    variational.getReferenceEnergy(), elapsedMs(t0));
        }

        // 6) 摂動級数
        RsptSeries series = null;
        if (request.isRsptEnabled()) {
            t0 = System.nanoTime();
            series = seriesGenerator.series(request.getRsptTargetState(), basis, w,
                    request.getRsptOrder());
            log.info("[5/5] 摂動級数: q={}、次数={}、所要時間={}ms", request.getRsptTargetState(),
                    request.getRsptOrder(), elapsedMs(t0));
        }

        log.info("計算が完了しました。N={}、合計所要時間={}ms", basis.size(), elapsedMs(tStart));
        return new CalculationResult(unshifted, basis, w, h, variational, series);
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
