package io.github.yok.vib.core.potential;

import io.github.yok.vib.core.harmonic.HarmonicMatrixElements;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * 非調和ポテンシャル（摂動演算子）を単項式の並びとして保持するクラスです。
 *
 * <p>
 * 単項式の順序に意味はありません。 全単項式のモード数が一致することを生成時に検証します。
 * </p>
 */
public final class AnharmonicPotential {

    /**
     * モード数 M です。
     */
    @Getter
    private final int modeCount;

    /**
     * 単項式の並びです。
     */
    private final List<AnharmonicTerm> terms;

    /**
     * ポテンシャルを生成します。
     *
     * @param modeCount モード数です（1 以上）
     * @param terms 単項式の並びです（null 不可、null 要素不可）
     * @throws IllegalArgumentException モード数が一致しない場合などに発生します
     */
    public AnharmonicPotential(int modeCount, List<AnharmonicTerm> terms) {
        if (modeCount <= 0) {
            throw new IllegalArgumentException("modeCount は 1 以上が必要です: " + modeCount);
        }
        if (terms == null) {
            throw new IllegalArgumentException("terms は null 不可です");
        }
        for (AnharmonicTerm t : terms) {
            if (t == null) {
                throw new IllegalArgumentException("terms に null が含まれています");
            }
            if (t.modeCount() != modeCount) {
                throw new IllegalArgumentException(
                        "単項式のモード数が一致しません: " + t + "（期待値 " + modeCount + "）");
            }
        }
        this.modeCount = modeCount;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    /**
     * 単項式の並びを返します。
     *
     * @return 単項式の並び（読み取り専用）です
     */
    public List<AnharmonicTerm> terms() {
        return terms;
    }

    /**
     * 単項式の数 K を返します。
     *
     * @return 単項式の数です
     */
    public int size() {
        return terms.size();
    }

    /**
     * 全単項式を通じたべき指数の最大値を返します。
     *
     * @return 最大次数です
     */
    public int maxPower() {
        int max = 0;
        for (AnharmonicTerm t : terms) {
            max = Math.max(max, t.maxPower());
        }
        return max;
    }

    /**
     * 閉形式の上限（8 次）を超えるべき指数を含む単項式を返します。
     *
     * <p>
     * これらの単項式は行列への寄与が 0 として扱われます。
     * </p>
     *
     * @return 上限超えの単項式です
     */
    public List<AnharmonicTerm> termsBeyondMaxOrder() {
        List<AnharmonicTerm> out = new ArrayList<>();
        for (AnharmonicTerm t : terms) {
            if (t.maxPower() > HarmonicMatrixElements.MAX_ORDER) {
                out.add(t);
            }
        }
        return out;
    }
}
