package com.example.harmonicmixer.dto;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * 曲目（由外部曲库提供，只读，以 id 作为身份）
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Track {

    @EqualsAndHashCode.Include
    String id;

    String title;

    String artist;

    String filepath;

    /**
     * Camelot 调性，例如 "8A"
     */
    String key;

    Double bpm;

    /**
     * 能量（1-10）
     */
    Double energy;

    /**
     * 情绪强度（1-10）
     */
    Double emotionalIntensity;

    String genre;

    /**
     * 时长（秒）
     */
    Double duration;

    /**
     * 文件当前是否可用
     */
    @Builder.Default
    boolean available = true;
}
