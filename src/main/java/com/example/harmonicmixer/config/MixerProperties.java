package com.example.harmonicmixer.config;

import com.example.harmonicmixer.skill.MixMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * 混音核心配置（mixer.*）
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "mixer")
public class MixerProperties {

    @Valid
    private Harmonic harmonic = new Harmonic();

    @Valid
    private Enhanced enhanced = new Enhanced();

    @Valid
    private Policy policy = new Policy();

    @Valid
    private Playlist playlist = new Playlist();

    @Data
    public static class Harmonic {

        /**
         * 默认混音模式（决定调性/BPM/能量/情绪四个维度的权重）
         */
        @NotNull
        private MixMode defaultMode = MixMode.INTELLIGENT;

        /**
         * BPM 容差
         */
        @Positive
        private double bpmTolerance = 6.0;

        /**
         * 能量容差（1-10 刻度）
         */
        @Positive
        private double energyTolerance = 2.0;
    }

    @Data
    public static class Enhanced {

        /**
         * 是否启用增强兼容性引擎（关闭后回退到基础和声评分）
         */
        private boolean enabled = true;
    }

    @Data
    public static class Policy {

        /**
         * 用户策略文件目录（policies.json）
         */
        @NotBlank
        private String configDir = System.getProperty("user.home") + "/.harmonic-mixer/policies";

        /**
         * 策略分数并入综合分数时的权重
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double blendWeight = 0.2;
    }

    @Data
    public static class Playlist {

        @Positive
        private int defaultTargetLength = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultMinCompatibility = 0.3;

        /**
         * 多候选模式下生成的歌单数量
         */
        @Positive
        private int candidateCount = 3;

        /**
         * 候选洗牌的随机种子（为空时不固定）
         */
        private Long shuffleSeed;

        /**
         * 状态图最大迭代次数的下限（防止无限循环）；实际上限按歌单长度放大
         */
        @Positive
        private int maxGraphIterations = 10000;
    }
}
