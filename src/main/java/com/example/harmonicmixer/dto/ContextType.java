package com.example.harmonicmixer.dto;

/**
 * 情境曲线的来源类型
 */
public enum ContextType {
    TIME,
    ACTIVITY,
    ENERGY,
    MOOD,
    SEASON
}
