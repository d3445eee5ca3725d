package com.example.harmonicmixer.policy;

/**
 * 策略配置错误：未知策略、重复 ID、缺少运算符的规则等
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
