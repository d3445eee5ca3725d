package com.example.harmonicmixer.skill;

import lombok.Value;

/**
 * 和声评分四个维度的权重
 */
@Value
public class HarmonicWeights {

    double key;
    double bpm;
    double energy;
    double emotional;

    public static HarmonicWeights of(MixMode mode) {
        return new HarmonicWeights(mode.getKeyWeight(), mode.getBpmWeight(),
            mode.getEnergyWeight(), mode.getEmotionalWeight());
    }
}
