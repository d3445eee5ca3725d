package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 风格画像：由 LLM 元数据临时构建，不持久化
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StyleProfile {

    private String subgenre;
    private String mood;
    private String era;
    private String language;

    /**
     * 可舞性（0-1）
     */
    private Double danceability;

    private String timeOfDay;
    private String activity;
    private String season;

    /**
     * 大众吸引力（0-1）
     */
    private Double crowdAppeal;

    /**
     * 混音友好度（0-1）
     */
    private Double mixFriendly;
}
