package com.example.harmonicmixer.context;

import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.GenerationInfo;
import com.example.harmonicmixer.dto.PlaylistRequest;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.skill.MixMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 选曲上下文：单次生成调用内的全部状态，由状态图节点读写
 */
@Data
public class PlaylistContext {

    private PlaylistRequest request;

    private MixMode harmonicMode;

    private int targetLength;

    private double minCompatibility;

    /**
     * 经典模式下为 null
     */
    private ContextualCurve curve;

    private List<Double> energyProgression = new ArrayList<>();

    /**
     * 尚未使用的候选曲目
     */
    private List<Track> candidates = new ArrayList<>();

    private List<Track> playlist = new ArrayList<>();

    private List<Double> trackScores = new ArrayList<>();

    private GenerationInfo generationInfo = new GenerationInfo();

    private Track currentTrack;

    /**
     * 需要填充的位置总数（含起始曲目）
     */
    private int limit;

    /**
     * 当前位置的最佳候选及其综合分（由 ScoreCandidatesNode 写入）
     */
    private Track bestCandidate;

    private double bestScore;

    private ExecutionControl control = new ExecutionControl();

    private Stage currentStage = Stage.INIT;

    public Map<String, Object> metadataFor(Track track) {
        return request.metadataFor(track);
    }

    public boolean isAllowRepeats() {
        return request.isAllowRepeats();
    }

    /**
     * 将曲目追加到歌单并成为当前曲目；不允许重复时从候选池移除
     */
    public void append(Track track, double score) {
        playlist.add(track);
        trackScores.add(score);
        currentTrack = track;
        if (!isAllowRepeats()) {
            candidates.remove(track);
        }
    }

    public enum Stage {
        INIT,               // 初始化
        CURVE_SELECTION,    // 选择情境曲线
        START_SELECTION,    // 选择起始曲目
        CANDIDATE_SCORING,  // 候选评分
        TRACK_ACCEPTED,     // 采纳达到阈值的候选
        FALLBACK,           // 兜底选择
        LOOP_CONTROL,       // 循环控制
        FINALIZE,           // 汇总结果
        END                 // 结束
    }
}
