package io.github.yok.vib.app;

import io.github.yok.vib.core.basis.ZeroOrderStateEnumerator;
import io.github.yok.vib.core.harmonic.HarmonicWeightTableCache;
import io.github.yok.vib.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vib.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vib.core.matrix.ClosedFormPerturbationMatrixBuilder;
import io.github.yok.vib.core.matrix.PerturbationMatrixBuilder;
import io.github.yok.vib.core.matrix.TabulatedPerturbationMatrixBuilder;
import io.github.yok.vib.core.series.RsptSeriesGenerator;
import io.github.yok.vib.core.solver.VariationalSolver;
import io.github.yok.vib.core.solver.VibrationalCalculator;
import io.github.yok.vib.input.MolecularInputReader;
import io.github.yok.vib.out.FileResultWriter;
import io.github.yok.vib.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 振動エネルギー計算（列挙、組み立て、変分計算、摂動級数）の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class VibCalculationConfiguration {

    /**
     * vib-solver の設定値（vib.*）です。
     */
    private final VibProperties p;

    /**
     * 入力表の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public MolecularInputReader molecularInputReader() {
        return new MolecularInputReader();
    }

    /**
     * ゼロ次状態の列挙ロジックを生成します。
     *
     * @return 列挙ロジックです
     */
    @Bean
    public ZeroOrderStateEnumerator zeroOrderStateEnumerator() {
        return new ZeroOrderStateEnumerator();
    }

    /**
     * 重み表のキャッシュを生成します。
     *
     * @return キャッシュです
     */
    @Bean
    public HarmonicWeightTableCache harmonicWeightTableCache() {
        return new HarmonicWeightTableCache();
    }

    /**
     * 設定された方式の摂動行列組み立てロジックを生成します。
     *
     * @param tableCache 重み表のキャッシュです
     * @return 組み立てロジックです
     */
    @Bean
    public PerturbationMatrixBuilder perturbationMatrixBuilder(
            HarmonicWeightTableCache tableCache) {
        VibProperties.Assembly a = p.getAssembly();
        switch (a.getMethod()) {
            case CLOSED_FORM:
                return new ClosedFormPerturbationMatrixBuilder();
            case TABULATED:
            default:
                return new TabulatedPerturbationMatrixBuilder(tableCache, a.getParallelism());
        }
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlSymmetricEigenDecompositionBackend();
    }

    /**
     * 変分計算ロジックを生成します。
     *
     * @param eigen 固有分解バックエンドです
     * @return 変分計算ロジックです
     */
    @Bean
    public VariationalSolver variationalSolver(EigenDecompositionBackend eigen) {
        return new VariationalSolver(eigen);
    }

    /**
     * 摂動級数の生成ロジックを生成します。
     *
     * @return 生成ロジックです
     */
    @Bean
    public RsptSeriesGenerator rsptSeriesGenerator() {
        return new RsptSeriesGenerator(p.getRspt().getPrecisionDigits());
    }

    /**
     * 計算手順全体の実行ロジックを生成します。
     *
     * @param enumerator 列挙ロジックです
     * @param builder 組み立てロジックです
     * @param variationalSolver 変分計算ロジックです
     * @param seriesGenerator 摂動級数の生成ロジックです
     * @return 実行ロジックです
     */
    @Bean
    public VibrationalCalculator vibrationalCalculator(ZeroOrderStateEnumerator enumerator,
            PerturbationMatrixBuilder builder, VariationalSolver variationalSolver,
            RsptSeriesGenerator seriesGenerator) {
        return new VibrationalCalculator(enumerator, builder, variationalSolver, seriesGenerator);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new FileResultWriter(p.getOutput().getDir());
    }
}
