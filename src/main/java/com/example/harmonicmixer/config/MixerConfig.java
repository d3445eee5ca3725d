package com.example.harmonicmixer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Slf4j
@Configuration
public class MixerConfig {

    /**
     * 多候选歌单生成时用于打乱候选顺序
     */
    @Bean
    public Random playlistShuffleRandom(MixerProperties properties) {
        Long seed = properties.getPlaylist().getShuffleSeed();
        if (seed != null) {
            log.info("[MixerConfig] 使用固定随机种子: {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
