package com.neoforge.orchestrator.credential;

/**
 * Per-run position in a {@link CredentialPool}.
 *
 * A sweep starts at the key that took the first rate limit after a
 * successful call. The pool counts as exhausted when rotation comes back to
 * that starting key, i.e. after every key has been rate-limited once in a
 * row. Each exhaustion bumps {@link #exhaustionCycle()}; any successful call
 * resets it and closes the sweep.
 *
 * Not thread-safe. A cursor belongs to exactly one engine run.
 */
public final class RotationCursor {

    private static final int NO_SWEEP = -1;

    private final CredentialPool pool;

    private int index;
    private int sweepStart = NO_SWEEP;
    private int exhaustionCycle;

    RotationCursor(CredentialPool pool) {
        this.pool = pool;
    }

    public Credential current()    { return pool.get(index); }
    public int index()             { return index; }
    public int exhaustionCycle()   { return exhaustionCycle; }
    public int poolSize()          { return pool.size(); }

    public void onSuccess() {
        exhaustionCycle = 0;
        sweepStart      = NO_SWEEP;
    }

    /**
     * Move to the next key after a rate limit.
     *
     * @return true when this rotation completed a full sweep of the pool
     */
    public boolean onRateLimited() {
        if (sweepStart == NO_SWEEP) {
            sweepStart = index;
        }
        index = pool.nextAfter(index);
        if (index == sweepStart) {
            exhaustionCycle++;
            return true;
        }
        return false;
    }
}
