package io.github.yok.vib.core.basis;

import static com.google.common.base.Preconditions.checkElementIndex;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * ゼロ次状態の順序付き集合（基底）を表すクラスです。
 *
 * <p>
 * 状態は (E, v1, v2, ..., vM) の昇順に並び、番号は 0 から密に振られます。 この順序は行列の行・列の順序そのものです。
 * 量子数の組は重複しません。
 * </p>
 *
 * <p>
 * エネルギーだけは周波数シフト（{@link #shiftEnergy(int, double)}）で書き換わりますが、並び順は変えません。
 * </p>
 */
public final class ZeroOrderBasis implements Iterable<ZeroOrderState> {

    /**
     * 基底の並び順（エネルギー、続いて量子数の辞書順）です。
     */
    public static final Comparator<ZeroOrderState> CANONICAL_ORDER =
            Comparator.comparingDouble(ZeroOrderState::getEnergy)
                    .thenComparing(ZeroOrderState::compareQuantumNumbers);

    /**
     * モード数 M です。
     */
    private final int modeCount;

    /**
     * 状態列です（位置 = 番号）。
     */
    private final List<ZeroOrderState> states;

    private ZeroOrderBasis(int modeCount, List<ZeroOrderState> states) {
        this.modeCount = modeCount;
        this.states = states;
    }

    /**
     * 状態の集まりを正規の順序に並べ、番号を振り直した基底を生成します。
     *
     * @param modeCount モード数です（1 以上）
     * @param unordered 状態の集まりです（null 不可）
     * @return 基底です
     * @throws IllegalArgumentException モード数の不一致、または量子数の組が重複する場合に発生します
     */
    public static ZeroOrderBasis sortedOf(int modeCount, Collection<ZeroOrderState> unordered) {
        if (modeCount <= 0) {
            throw new IllegalArgumentException("modeCount は 1 以上が必要です: " + modeCount);
        }
        if (unordered == null) {
            throw new IllegalArgumentException("states は null 不可です");
        }
        List<ZeroOrderState> sorted = new ArrayList<>(unordered);
        Set<List<Integer>> seen = new HashSet<>();
        for (ZeroOrderState s : sorted) {
            if (s.modeCount() != modeCount) {
                throw new IllegalArgumentException(
                        "状態のモード数が一致しません: " + s + "（期待値 " + modeCount + "）");
            }
            // エネルギーが異なっていても量子数の組が同じなら重複です。
            if (!seen.add(Ints.asList(s.quantumNumbers()))) {
                throw new IllegalArgumentException("量子数の組が重複しています: " + s);
            }
        }
        sorted.sort(CANONICAL_ORDER);

        List<ZeroOrderState> indexed = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            indexed.add(sorted.get(i).withIndex(i));
        }
        return new ZeroOrderBasis(modeCount, indexed);
    }

    /**
     * 条件を満たす状態だけを残し、番号を 0 から振り直した基底を返します。
     *
     * @param filter 残す状態の条件です（null 不可）
     * @return 新しい基底です（空になり得ます）
     */
    public ZeroOrderBasis filter(Predicate<ZeroOrderState> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter は null 不可です");
        }
        List<ZeroOrderState> kept = new ArrayList<>();
        for (ZeroOrderState s : states) {
            if (filter.test(s)) {
                kept.add(s.withIndex(kept.size()));
            }
        }
        return new ZeroOrderBasis(modeCount, kept);
    }

    /**
     * 指定状態のエネルギーに delta を加えます（並び順は変えません）。
     *
     * @param index 状態番号です
     * @param delta 加えるエネルギーです
     */
    public void shiftEnergy(int index, double delta) {
        checkElementIndex(index, states.size(), "index");
        ZeroOrderState s = states.get(index);
        states.set(index, s.withEnergy(s.getEnergy() + delta));
    }

    /**
     * 複製を返します（周波数シフトを試す前の退避用）。
     *
     * @return 複製です
     */
    public ZeroOrderBasis copy() {
        return new ZeroOrderBasis(modeCount, new ArrayList<>(states));
    }

    /**
     * 状態数 N を返します。
     *
     * @return 状態数です
     */
    public int size() {
        return states.size();
    }

    /**
     * 空かどうかを返します。
     *
     * @return 空の場合は true です
     */
    public boolean isEmpty() {
        return states.isEmpty();
    }

    /**
     * モード数 M を返します。
     *
     * @return モード数です
     */
    public int modeCount() {
        return modeCount;
    }

    /**
     * 指定番号の状態を返します。
     *
     * @param index 状態番号です
     * @return 状態です
     */
    public ZeroOrderState get(int index) {
        checkElementIndex(index, states.size(), "index");
        return states.get(index);
    }

    /**
     * 量子数の組から状態番号を返します。
     *
     * @param quantumNumbers 量子数の組です
     * @return 状態番号です（見つからない場合は -1）
     */
    public int indexOf(int... quantumNumbers) {
        for (ZeroOrderState s : states) {
            if (Arrays.equals(s.quantumNumbers(), quantumNumbers)) {
                return s.getIndex();
            }
        }
        return -1;
    }

    /**
     * ゼロ次エネルギーの配列を返します。
     *
     * @return エネルギー配列です（位置 = 状態番号）
     */
    public double[] energies() {
        double[] e = new double[states.size()];
        for (int i = 0; i < e.length; i++) {
            e[i] = states.get(i).getEnergy();
        }
        return e;
    }

    /**
     * 全状態・全モードを通じた量子数の最大値を返します。
     *
     * @return 量子数の最大値です
     */
    public int maxQuantumNumber() {
        int max = 0;
        for (ZeroOrderState s : states) {
            max = Math.max(max, s.maxQuantumNumber());
        }
        return max;
    }

    /**
     * 状態列の読み取り専用ビューを返します。
     *
     * @return 状態列です
     */
    public List<ZeroOrderState> states() {
        return Collections.unmodifiableList(states);
    }

    @Override
    public Iterator<ZeroOrderState> iterator() {
        return states().iterator();
    }
}
