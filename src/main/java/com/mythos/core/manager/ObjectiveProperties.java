package com.mythos.core.manager;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Capacity and retention settings for the objective manager.
 */
@Component
@ConfigurationProperties(prefix = "mythos.objectives")
public class ObjectiveProperties {

    private int maxActiveObjectives = 20;
    private int maxImmediateObjectives = 5;
    private int maxShortTermObjectives = 10;
    private boolean autoCleanupCompleted = true;
    private int autoCleanupAfterHours = 24;
    private int recentEventLimit = 100;

    public int getMaxActiveObjectives() {
        return maxActiveObjectives;
    }

    public void setMaxActiveObjectives(int maxActiveObjectives) {
        this.maxActiveObjectives = maxActiveObjectives;
    }

    public int getMaxImmediateObjectives() {
        return maxImmediateObjectives;
    }

    public void setMaxImmediateObjectives(int maxImmediateObjectives) {
        this.maxImmediateObjectives = maxImmediateObjectives;
    }

    public int getMaxShortTermObjectives() {
        return maxShortTermObjectives;
    }

    public void setMaxShortTermObjectives(int maxShortTermObjectives) {
        this.maxShortTermObjectives = maxShortTermObjectives;
    }

    public boolean isAutoCleanupCompleted() {
        return autoCleanupCompleted;
    }

    public void setAutoCleanupCompleted(boolean autoCleanupCompleted) {
        this.autoCleanupCompleted = autoCleanupCompleted;
    }

    public int getAutoCleanupAfterHours() {
        return autoCleanupAfterHours;
    }

    public void setAutoCleanupAfterHours(int autoCleanupAfterHours) {
        this.autoCleanupAfterHours = autoCleanupAfterHours;
    }

    public int getRecentEventLimit() {
        return recentEventLimit;
    }

    public void setRecentEventLimit(int recentEventLimit) {
        this.recentEventLimit = recentEventLimit;
    }
}
