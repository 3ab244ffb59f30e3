package com.legal.consult.dto;

/**
 * Fixed generation parameters for one provider.
 */
public final class ModelConfig {

    private final String model;
    private final int maxTokens;
    private final double temperature;

    public ModelConfig(String model, int maxTokens, double temperature) {
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = Math.max(0.0, Math.min(2.0, temperature));
    }

    public String getModel() {
        return model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }
}
