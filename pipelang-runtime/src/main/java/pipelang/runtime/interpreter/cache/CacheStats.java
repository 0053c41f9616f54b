package pipelang.runtime.interpreter.cache;

/**
 * 缓存统计快照
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadFailureCount;
    private final long evictionCount;
    private final long estimatedSize;
    private final long maximumSize;

    public CacheStats(long hitCount, long missCount, long loadFailureCount,
                      long evictionCount, long estimatedSize, long maximumSize) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadFailureCount = loadFailureCount;
        this.evictionCount = evictionCount;
        this.estimatedSize = estimatedSize;
        this.maximumSize = maximumSize;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getLoadFailureCount() { return loadFailureCount; }
    public long getEvictionCount() { return evictionCount; }
    public long getEstimatedSize() { return estimatedSize; }
    public long getMaximumSize() { return maximumSize; }

    public double getHitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    @Override
    public String toString() {
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, failures=%d, evictions=%d, size=%d/%d",
                hitCount, missCount, getHitRate() * 100, loadFailureCount, evictionCount,
                estimatedSize, maximumSize);
    }
}
