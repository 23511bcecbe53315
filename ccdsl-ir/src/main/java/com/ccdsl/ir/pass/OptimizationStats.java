package com.ccdsl.ir.pass;

/**
 * 优化统计
 */
public final class OptimizationStats {

    private int constantsPropagated;
    private int constantsFolded;
    private int expressionsSimplified;
    private int deadStatementsRemoved;
    private int iterations;

    public void propagated() { constantsPropagated++; }
    public void folded() { constantsFolded++; }
    public void simplified() { expressionsSimplified++; }
    public void removed(int count) { deadStatementsRemoved += count; }
    void iteration() { iterations++; }

    public int getConstantsPropagated() { return constantsPropagated; }
    public int getConstantsFolded() { return constantsFolded; }
    public int getExpressionsSimplified() { return expressionsSimplified; }
    public int getDeadStatementsRemoved() { return deadStatementsRemoved; }
    public int getIterations() { return iterations; }

    /** 所有 pass 的改写总数 */
    public int getTotalRewrites() {
        return constantsPropagated + constantsFolded + expressionsSimplified + deadStatementsRemoved;
    }

    /** 把另一份统计累加进来（多合约汇总） */
    public void add(OptimizationStats other) {
        constantsPropagated += other.constantsPropagated;
        constantsFolded += other.constantsFolded;
        expressionsSimplified += other.expressionsSimplified;
        deadStatementsRemoved += other.deadStatementsRemoved;
        iterations += other.iterations;
    }

    @Override
    public String toString() {
        return "propagated=" + constantsPropagated
                + ", folded=" + constantsFolded
                + ", simplified=" + expressionsSimplified
                + ", removed=" + deadStatementsRemoved
                + ", iterations=" + iterations;
    }
}
