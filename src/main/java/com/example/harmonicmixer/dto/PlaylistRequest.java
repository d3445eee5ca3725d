package com.example.harmonicmixer.dto;

import com.example.harmonicmixer.skill.MixMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 歌单生成请求
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistRequest {

    public static final String MODE_CONTEXTUAL = "contextual";
    public static final String MODE_CLASSIC = "classic";

    /**
     * 候选曲目池
     */
    @NotNull
    @Builder.Default
    private List<Track> tracks = new ArrayList<>();

    /**
     * trackId -> LLM 元数据
     */
    @Builder.Default
    private Map<String, Map<String, Object>> metadata = new HashMap<>();

    /**
     * 目标长度，为空时使用 mixer.playlist.default-target-length
     */
    @Positive
    private Integer targetLength;

    private String timeOfDay;

    private String activity;

    private String moodPreference;

    private String season;

    private Integer durationMinutes;

    /**
     * 指定起始曲目（可选）
     */
    private Track startTrack;

    /**
     * warm_up / peak_time / cool_down
     */
    private String energyPreference;

    private boolean allowRepeats;

    /**
     * 最低兼容分，为空时使用 mixer.playlist.default-min-compatibility
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double minCompatibility;

    /**
     * 生成模式：contextual（默认）/ classic
     */
    private String mode;

    /**
     * 经典模式下的能量走向：neutral / ascending / descending
     */
    private String progressionCurve;

    /**
     * 和声评分模式，为空时使用 mixer.harmonic.default-mode
     */
    private MixMode harmonicMode;

    public Map<String, Object> metadataFor(Track track) {
        if (metadata == null || track == null) {
            return Map.of();
        }
        Map<String, Object> m = metadata.get(track.getId());
        return m != null ? m : Map.of();
    }
}
