package com.taskweaver.core.error;

/**
 * Thrown when a session tries to delegate beyond the configured nesting depth.
 */
public class RecursionLimitExceededException extends DelegationException {

    private final int currentLevel;
    private final int maxLevel;

    public RecursionLimitExceededException(int currentLevel, int maxLevel) {
        super("Maximum recursion level reached: " + maxLevel + " (current level: " + currentLevel
                + "). Cannot create further subtasks.");
        this.currentLevel = currentLevel;
        this.maxLevel = maxLevel;
    }

    public int getCurrentLevel() {
        return currentLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }
}
