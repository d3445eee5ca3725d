package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 歌单生成结果。空歌单表示无法选出起始曲目，调用方需要自行检查
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistResult {

    @Builder.Default
    private List<Track> playlist = new ArrayList<>();

    /**
     * 经典模式下为 null
     */
    private ContextualCurve curve;

    @Builder.Default
    private List<Double> energyProgression = new ArrayList<>();

    /**
     * 每个位置的选择分数，与 playlist 一一对应
     */
    @Builder.Default
    private List<Double> trackScores = new ArrayList<>();

    private GenerationInfo generationInfo;

    /**
     * trackScores 的平均值
     */
    private double totalScore;

    public boolean isEmpty() {
        return playlist == null || playlist.isEmpty();
    }
}
