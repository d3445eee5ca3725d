package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 能量曲线采样点（能量已归一化到 0-1）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnergySample {

    private double timeSeconds;

    private double energy;
}
