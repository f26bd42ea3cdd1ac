package org.nowstart.perpbot.data.dto;

public record MlScore(
        Double score,
        int modelSamples
) {

    public static MlScore unavailable() {
        return new MlScore(null, 0);
    }

    public boolean isPresent() {
        return score != null && Double.isFinite(score);
    }

    public double blendWeight() {
        return Math.min(modelSamples / 500.0, 0.6);
    }

    public double blend(double ruleConfidence) {
        if (!isPresent()) {
            return ruleConfidence;
        }
        double weight = blendWeight();
        return ruleConfidence * (1 - weight) + score * weight;
    }
}
