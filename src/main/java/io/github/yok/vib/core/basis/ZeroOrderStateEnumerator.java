package io.github.yok.vib.core.basis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * ゼロ次エネルギーが上限以下となる量子数の組をすべて列挙するクラスです。
 *
 * <p>
 * モードごとの深さ優先探索で、各モードについて「現在の量子数のまま次のモードへ進む（分岐 A）」と 「現在のモードの量子数を 1
 * 増やして同じモードを続ける（分岐 B）」を試します。 分岐 B はエネルギーが上限を超えた時点で打ち切ります。 再帰の代わりに明示的なスタックを使うため、
 * モード数が多くても呼び出し深さの制限を受けません。
 * </p>
 */
@Slf4j
public final class ZeroOrderStateEnumerator {

    /**
     * 零点エネルギー Σ ω_i / 2 から列挙し、(E, v1, ..., vM) 昇順に並べた基底を返します。
     *
     * @param energyCutoff エネルギー上限 Emax です
     * @param frequencies 調和振動数の配列です（各要素は正の有限値）
     * @return 基底です（Emax が零点エネルギー未満の場合は空）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ZeroOrderBasis enumerate(double energyCutoff, double[] frequencies) {
        validate(energyCutoff, frequencies);

        double zeroPointEnergy = 0.0;
        for (double f : frequencies) {
            zeroPointEnergy += f;
        }
        zeroPointEnergy /= 2.0;

        long t0 = System.nanoTime();
        List<ZeroOrderState> states = generate(zeroPointEnergy, energyCutoff, frequencies);
        ZeroOrderBasis basis = ZeroOrderBasis.sortedOf(frequencies.length, states);

        log.info("ゼロ次状態を列挙しました。Emax={}、零点エネルギー={}、状態数={}、所要時間={}ms", energyCutoff,
                zeroPointEnergy, basis.size(), (System.nanoTime() - t0) / 1_000_000L);
        return basis;
    }

    /**
     * 深さ優先探索の生成順のまま状態を返します（並べ替えも番号の振り直しもしません）。
     *
     * <p>
     * 各状態のエネルギーは {@code startEnergy + Σ ω_i v_i} です。 {@code startEnergy} に零点エネルギーを渡すと
     * {@code Σ ω_i (v_i + 1/2)} になります。 番号は生成順です。
     * </p>
     *
     * @param startEnergy 全量子数 0 の状態のエネルギーです
     * @param energyCutoff エネルギー上限 Emax です（上限ちょうどの状態も含みます）
     * @param frequencies 調和振動数の配列です（各要素は正の有限値）
     * @return 生成順の状態列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public List<ZeroOrderState> generate(double startEnergy, double energyCutoff,
            double[] frequencies) {
        validate(energyCutoff, frequencies);
        if (!Double.isFinite(startEnergy)) {
            throw new IllegalArgumentException("startEnergy は有限値が必要です: " + startEnergy);
        }

        int modeCount = frequencies.length;
        List<ZeroOrderState> out = new ArrayList<>();

        // 分岐 A を先に処理するため、B → A の順に積みます。
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(new int[modeCount], startEnergy, 0));

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (f.mode >= modeCount) {
                out.add(new ZeroOrderState(out.size(), f.quanta, f.energy));
                continue;
            }
            if (f.energy > energyCutoff) {
                continue;
            }
            int[] incremented = f.quanta.clone();
            incremented[f.mode]++;
            stack.push(new Frame(incremented, f.energy + frequencies[f.mode], f.mode));
            stack.push(new Frame(f.quanta, f.energy, f.mode + 1));
        }
        return out;
    }

    private static void validate(double energyCutoff, double[] frequencies) {
        if (frequencies == null || frequencies.length == 0) {
            throw new IllegalArgumentException("frequencies は 1 要素以上が必要です");
        }
        for (double f : frequencies) {
            if (!(f > 0.0) || !Double.isFinite(f)) {
                throw new IllegalArgumentException("振動数は正の有限値が必要です: " + f);
            }
        }
        if (!Double.isFinite(energyCutoff)) {
            throw new IllegalArgumentException("energyCutoff は有限値が必要です: " + energyCutoff);
        }
    }

    /**
     * 探索スタックの 1 要素です。 quanta は積んだ後に書き換えません。
     */
    private static final class Frame {

        final int[] quanta;

        final double energy;

        final int mode;

        Frame(int[] quanta, double energy, int mode) {
            this.quanta = quanta;
            this.energy = energy;
            this.mode = mode;
        }
    }
}
