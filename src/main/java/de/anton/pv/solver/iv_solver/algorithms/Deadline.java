package de.anton.pv.solver.iv_solver.algorithms;

import java.time.Duration;

/**
 * Wall-clock budget shared by the stages of one analysis.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(0L, false);

    private final long expiresAtNanos;
    private final boolean bounded;

    private Deadline(long expiresAtNanos, boolean bounded) {
        this.expiresAtNanos = expiresAtNanos;
        this.bounded = bounded;
    }

    /** A deadline {@code budget} from now; zero or negative means unbounded. */
    public static Deadline after(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + budget.toNanos(), true);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() - expiresAtNanos > 0;
    }

    /**
     * @throws BudgetExceededException if the deadline has passed.
     */
    public void check(String stage) {
        if (isExpired()) {
            throw new BudgetExceededException("Wall-clock budget exceeded during " + stage + ".");
        }
    }
}
