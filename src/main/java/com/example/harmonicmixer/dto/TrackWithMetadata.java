package com.example.harmonicmixer.dto;

import lombok.Value;

import java.util.Map;

/**
 * 曲目及其 LLM 元数据
 */
@Value
public class TrackWithMetadata {

    Track track;

    Map<String, Object> metadata;
}
