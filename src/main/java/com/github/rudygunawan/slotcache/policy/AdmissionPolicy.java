package com.github.rudygunawan.slotcache.policy;

/**
 * Decides whether a new entry may displace the current eviction candidate of a full cache.
 *
 * <p>The policy is consulted only when the cache is full <em>and</em> the new entry's metric is
 * less favorable (numerically lower) than the metric of the entry that would be evicted. When the
 * new metric is equal or higher, the candidate is always evicted without asking.
 *
 * <p>For priority caches this means the new item has a lower priority than every stored item.
 * For time-ordered caches it can only happen when the clock went backwards, so the current time is
 * earlier than the last access of the oldest entry.
 *
 * <p><b>Example - keep only the highest priorities:</b>
 * <pre>{@code
 * PriorityCache<String> top = CacheBuilder.newBuilder()
 *     .maximumSize(100)
 *     .admissionPolicy(AdmissionPolicy.rejectLessFavorable())
 *     .buildPriority();
 *
 * ValueRef<String> ref = top.create(key, score);
 * if (ref != null) {
 *     ref.set(payload);   // admitted
 * }
 * }</pre>
 */
@FunctionalInterface
public interface AdmissionPolicy {

    /**
     * Returns whether the new entry should replace the current minimum.
     *
     * @param newMetric the metric of the entry about to be created
     * @param currentMinimumMetric the metric of the entry that would be evicted
     * @return {@code true} to evict the current minimum and admit the new entry, {@code false} to
     *         reject the new entry and leave the cache untouched
     */
    boolean acceptReplacement(long newMetric, long currentMinimumMetric);

    /**
     * Returns the default policy: the incoming entry always wins.
     */
    static AdmissionPolicy alwaysAdmit() {
        return Admission.ALWAYS;
    }

    /**
     * Returns a policy that keeps the stored entries when the incoming entry is less favorable.
     */
    static AdmissionPolicy rejectLessFavorable() {
        return Admission.REJECT_LESS_FAVORABLE;
    }

    /**
     * Built-in policies.
     */
    enum Admission implements AdmissionPolicy {
        ALWAYS {
            @Override
            public boolean acceptReplacement(long newMetric, long currentMinimumMetric) {
                return true;
            }
        },
        REJECT_LESS_FAVORABLE {
            @Override
            public boolean acceptReplacement(long newMetric, long currentMinimumMetric) {
                return false;
            }
        }
    }
}
