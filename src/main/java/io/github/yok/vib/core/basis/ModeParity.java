package io.github.yok.vib.core.basis;

import java.util.List;
import java.util.function.Predicate;

/**
 * モードごとの量子数の偶奇による基底の選別条件です。
 *
 * <p>
 * 対称性で分離できるブロック（例: v3 が奇数の状態のみ）だけを対角化したい場合に使います。
 * </p>
 */
public enum ModeParity {

    /**
     * 選別しません。
     */
    ANY,

    /**
     * 偶数の量子数のみ残します。
     */
    EVEN,

    /**
     * 奇数の量子数のみ残します。
     */
    ODD;

    /**
     * 量子数が条件を満たすかどうかを返します。
     *
     * @param v 量子数です
     * @return 条件を満たす場合は true です
     */
    public boolean accepts(int v) {
        switch (this) {
            case EVEN:
                return (v & 1) == 0;
            case ODD:
                return (v & 1) == 1;
            default:
                return true;
        }
    }

    /**
     * モードごとの偶奇条件から状態の選別条件を作ります。
     *
     * @param parities モードごとの偶奇条件です（長さはモード数と一致が必要です）
     * @return 状態の選別条件です
     * @throws IllegalArgumentException parities が null、または長さがモード数と一致しない場合に発生します
     */
    public static Predicate<ZeroOrderState> filterOf(List<ModeParity> parities) {
        if (parities == null) {
            throw new IllegalArgumentException("parities は null 不可です");
        }
        ModeParity[] p = parities.toArray(new ModeParity[0]);
        return state -> {
            if (state.modeCount() != p.length) {
                throw new IllegalArgumentException("偶奇条件の長さがモード数と一致しません: " + p.length + " vs "
                        + state.modeCount());
            }
            for (int mode = 0; mode < p.length; mode++) {
                if (p[mode] != null && !p[mode].accepts(state.quantumNumber(mode))) {
                    return false;
                }
            }
            return true;
        };
    }
}
