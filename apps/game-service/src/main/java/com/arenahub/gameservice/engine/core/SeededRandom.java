package com.arenahub.gameservice.engine.core;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 可持久化的确定性随机源（48 位线性同余，与 java.util.Random 同一递推式）。
 * 游标 state 随对局数据一起序列化，恢复后继续产出同一序列。
 * 所有影响结果的随机决策都必须从这里取值。
 */
@Data
@NoArgsConstructor
public class SeededRandom {

    private static final long MULTIPLIER = 0x5DEECE66DL;
    private static final long ADDEND = 0xBL;
    private static final long MASK = (1L << 48) - 1;

    /** 初始种子，仅作记录 */
    private long seed;
    /** 当前游标 */
    private long state;

    public SeededRandom(long seed) {
        this.seed = seed;
        this.state = (seed ^ MULTIPLIER) & MASK;
    }

    public SeededRandom copy() {
        SeededRandom r = new SeededRandom();
        r.seed = seed;
        r.state = state;
        return r;
    }

    private int next(int bits) {
        state = (state * MULTIPLIER + ADDEND) & MASK;
        return (int) (state >>> (48 - bits));
    }

    /** [0, 1) */
    public double nextDouble() {
        return (((long) next(26) << 27) + next(27)) * 0x1.0p-53;
    }

    /** [0, bound) */
    public int nextInt(int bound) {
        if (bound <= 0) throw new IllegalArgumentException("bound must be positive");
        return (int) Math.floor(nextDouble() * bound);
    }

    /** [lo, hi] 闭区间 */
    public int between(int lo, int hi) {
        return lo + nextInt(hi - lo + 1);
    }

    /** 以概率 p 返回 true */
    public boolean chance(double p) {
        return nextDouble() < p;
    }

    public <T> T pick(List<T> items) {
        return items.get(nextInt(items.size()));
    }

    /** Fisher-Yates 原地洗牌 */
    public <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
    }
}
