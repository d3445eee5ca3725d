package com.example.harmonicmixer.dto;

/**
 * 曲目结构段落标签
 */
public enum StructuralElement {
    INTRO,
    VERSE,
    CHORUS,
    BRIDGE,
    OUTRO,
    BREAK,
    BUILDUP,
    DROP
}
