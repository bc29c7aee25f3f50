package com.github.rudygunawan.slotcache.api;

/**
 * The outcome of checking a key against an {@link ExpiringCache}.
 */
public enum EntryState {
    /** The entry exists and its lifetime has not elapsed. */
    LIVE,
    /** The entry existed but its lifetime had elapsed, so it was removed by the check. */
    EXPIRED,
    /** No entry with the key exists. */
    ABSENT;

    /**
     * Returns whether the entry was found live.
     */
    public boolean isLive() {
        return this == LIVE;
    }
}
