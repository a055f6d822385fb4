package com.healthassist.common.exception;

/**
 * 请求参数不合法（空症状、超长、无有效字符、年龄非正数等）
 */
public class InvalidSymptomException extends IllegalArgumentException {

    public InvalidSymptomException(String message) {
        super(message);
    }
}
