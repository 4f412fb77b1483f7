package com.mythos.core.ai;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning of suggestion generation and difficulty adjustment.
 */
@Component
@ConfigurationProperties(prefix = "mythos.ai")
public class AiProperties {

    private double minConfidence = 0.6;
    private int maxSuggestions = 5;
    private double targetSuccessRate = 0.7;
    private double adjustmentSensitivity = 0.1;
    private int performanceWindow = 10;
    private int suggestionHistoryLimit = 100;

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    public double getTargetSuccessRate() {
        return targetSuccessRate;
    }

    public void setTargetSuccessRate(double targetSuccessRate) {
        this.targetSuccessRate = targetSuccessRate;
    }

    public double getAdjustmentSensitivity() {
        return adjustmentSensitivity;
    }

    public void setAdjustmentSensitivity(double adjustmentSensitivity) {
        this.adjustmentSensitivity = adjustmentSensitivity;
    }

    public int getPerformanceWindow() {
        return performanceWindow;
    }

    public void setPerformanceWindow(int performanceWindow) {
        this.performanceWindow = performanceWindow;
    }

    public int getSuggestionHistoryLimit() {
        return suggestionHistoryLimit;
    }

    public void setSuggestionHistoryLimit(int suggestionHistoryLimit) {
        this.suggestionHistoryLimit = suggestionHistoryLimit;
    }
}
