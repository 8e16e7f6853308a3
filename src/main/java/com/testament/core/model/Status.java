package com.testament.core.model;

/**
 * Outcome of a test, fixture or container.
 */
public enum Status {
    PASSED,
    FAILED,
    SKIPPED;

    /**
     * Applies the container rollup rule.
     * <p>
     * A container whose children are all skipped is skipped. Otherwise it passes only when
     * at least one child passed and none failed or skipped.
     *
     * @param childCount  number of children considered
     * @param allSkipped  whether every child is skipped
     * @param passed      passed count
     * @param failed      failed count
     * @param skipped     skipped count
     */
    public static Status rollup(int childCount, boolean allSkipped, int passed, int failed, int skipped) {
        if (childCount == 0 || allSkipped) {
            return SKIPPED;
        }
        return passed > 0 && failed == 0 && skipped == 0 ? PASSED : FAILED;
    }
}
