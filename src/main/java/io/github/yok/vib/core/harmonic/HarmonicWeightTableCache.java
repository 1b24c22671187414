package io.github.yok.vib.core.harmonic;

import static com.google.common.base.Preconditions.checkArgument;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link HarmonicWeightTable} を (最大次数, 最大量子数) ごとに保持するキャッシュです。
 *
 * <p>
 * 同じ分子で基底を変えながら何度も行列を組み立てる場合に、表の再構築を避けます。
 * </p>
 */
@Slf4j
public final class HarmonicWeightTableCache {

    /**
     * 既定の最大保持数です。
     */
    private static final long DEFAULT_MAXIMUM_SIZE = 16;

    private final LoadingCache<Key, HarmonicWeightTable> tables;

    /**
     * 既定の最大保持数でキャッシュを生成します。
     */
    public HarmonicWeightTableCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * キャッシュを生成します。
     *
     * @param maximumSize 最大保持数です（1 以上）
     * @throws IllegalArgumentException maximumSize が 1 未満の場合に発生します
     */
    public HarmonicWeightTableCache(long maximumSize) {
        checkArgument(maximumSize > 0, "maximumSize は 1 以上が必要です: %s", maximumSize);
        this.tables = CacheBuilder.newBuilder().maximumSize(maximumSize)
                .build(new CacheLoader<Key, HarmonicWeightTable>() {
                    @Override
                    public HarmonicWeightTable load(Key key) {
                        long t0 = System.nanoTime();
                        HarmonicWeightTable table =
                                HarmonicWeightTable.build(key.maxQuantumNumber, key.maxOrder);
                        log.debug("重み表を構築しました。nmax={}、vmax={}、要素数={}、所要時間={}ms",
                                key.maxOrder, key.maxQuantumNumber, table.size(),
                                (System.nanoTime() - t0) / 1_000_000L);
                        return table;
                    }
                });
    }

    /**
     * 重み表を返します（未構築なら構築します）。
     *
     * @param maxQuantumNumber 量子数の最大値です（0 以上）
     * @param maxOrder 次数の最大値です（0 以上。8 を超える指定は 8 として扱います）
     * @return 重み表です
     * @throws IllegalArgumentException 引数が負の場合に発生します
     */
    public HarmonicWeightTable get(int maxQuantumNumber, int maxOrder) {
        checkArgument(maxQuantumNumber >= 0, "maxQuantumNumber は 0 以上が必要です: %s",
                maxQuantumNumber);
        checkArgument(maxOrder >= 0, "maxOrder は 0 以上が必要です: %s", maxOrder);
        int nmax = Math.min(maxOrder, HarmonicMatrixElements.MAX_ORDER);
        return tables.getUnchecked(new Key(nmax, maxQuantumNumber));
    }

    /**
     * 現在保持している表の数を返します。
     *
     * @return 表の数です
     */
    public long size() {
        return tables.size();
    }

    @Value
    private static class Key {

        int maxOrder;

        int maxQuantumNumber;
    }
}
