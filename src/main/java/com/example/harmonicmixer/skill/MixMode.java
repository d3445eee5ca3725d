package com.example.harmonicmixer.skill;

/**
 * 混音模式：每种模式对应一组 调性/BPM/能量/情绪 权重
 */
public enum MixMode {
    CLASSIC(0.9, 0.1, 0.0, 0.0),        // 传统 Camelot，调性主导
    INTELLIGENT(0.4, 0.3, 0.2, 0.1),    // 默认
    ENERGY(0.2, 0.2, 0.5, 0.1),         // 能量流主导
    EMOTIONAL(0.2, 0.1, 0.2, 0.5),      // 情绪主导
    STRUCTURAL(0.25, 0.25, 0.25, 0.25); // 四维均分

    private final double keyWeight;
    private final double bpmWeight;
    private final double energyWeight;
    private final double emotionalWeight;

    MixMode(double keyWeight, double bpmWeight, double energyWeight, double emotionalWeight) {
        this.keyWeight = keyWeight;
        this.bpmWeight = bpmWeight;
        this.energyWeight = energyWeight;
        this.emotionalWeight = emotionalWeight;
    }

    public double getKeyWeight() {
        return keyWeight;
    }

    public double getBpmWeight() {
        return bpmWeight;
    }

    public double getEnergyWeight() {
        return energyWeight;
    }

    public double getEmotionalWeight() {
        return emotionalWeight;
    }
}
