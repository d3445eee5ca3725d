package com.example.harmonicmixer.dto;

import lombok.Value;

/**
 * 风格桥接候选曲目及其桥接分数
 */
@Value
public class BridgeCandidate {

    Track track;

    double score;
}
