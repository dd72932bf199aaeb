package io.fetch4j.core;

/**
 * Result of unscheduling a job.
 *
 * matched  : the job id exists in the store
 * modified : the job was active and has now been disabled
 */
public record UnscheduleResult(
        boolean matched,
        boolean modified
) {

    public static UnscheduleResult notFound() {
        return new UnscheduleResult(false, false);
    }

    public static UnscheduleResult alreadyInactive() {
        return new UnscheduleResult(true, false);
    }

    public static UnscheduleResult disabled() {
        return new UnscheduleResult(true, true);
    }

    public boolean hasEffect() {
        return modified;
    }
}
