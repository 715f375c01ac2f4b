package com.playlistsync.sync;

/**
 * Lifecycle of a single source track within one sync run.
 * <p>
 * Transitions are strictly forward: {@code PENDING -> SEARCHING -> {FOUND | NOT_FOUND | SKIPPED}}.
 * The three outcomes are terminal.
 */
public enum TrackStatus {
    PENDING,
    SEARCHING,
    FOUND,
    NOT_FOUND,
    SKIPPED;

    public boolean isTerminal() {
        return this == FOUND || this == NOT_FOUND || this == SKIPPED;
    }

    /**
     * @param next requested status
     * @return true if moving from this status to {@code next} keeps the lifecycle monotonic
     */
    public boolean canAdvanceTo(TrackStatus next) {
        if (next == null || isTerminal()) return false;
        return next.ordinal() > ordinal() && (this != PENDING || next == SEARCHING);
    }

    /**
     * Lower-case name used in reports and log lines, e.g. {@code not_found}.
     */
    public String label() {
        return name().toLowerCase();
    }
}
