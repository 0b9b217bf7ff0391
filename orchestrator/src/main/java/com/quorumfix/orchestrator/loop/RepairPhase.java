package com.quorumfix.orchestrator.loop;

/**
 * Phases of one repair iteration. A run that aborts reports the phase it was in.
 */
public enum RepairPhase {
    RUN_TESTS,
    GATHER_CONTEXT,
    FAN_OUT,
    RESOLVE,
    APPLY_FIX;

    /** Lower-case label used in failure reasons and logs. */
    public String label() {
        return name().toLowerCase().replace('_', ' ');
    }
}
