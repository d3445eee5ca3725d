package com.example.harmonicmixer.context;

import lombok.Data;

/**
 * 执行控制（循环控制变量）
 *
 * 包含状态图执行过程中的控制标志：
 * 1. 当前要填充的歌单位置
 * 2. 继续/终止标志
 * 3. 外部取消标志（可由其他线程设置，在位置之间检查）
 */
@Data
public class ExecutionControl {

    /**
     * 下一个要填充的位置（起始曲目占位置 0）
     */
    private int position = 1;

    /**
     * 是否继续选曲
     */
    private boolean shouldContinue = true;

    private volatile boolean cancelled = false;

    /**
     * 移动到下一个位置
     */
    public void advance() {
        this.position++;
    }

    public void stop() {
        this.shouldContinue = false;
    }

    public void cancel() {
        this.cancelled = true;
    }
}
