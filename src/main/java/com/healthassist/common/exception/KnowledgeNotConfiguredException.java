package com.healthassist.common.exception;

/**
 * 知识库规则表配置缺失或不完整，仅在启动加载阶段抛出
 */
public class KnowledgeNotConfiguredException extends IllegalStateException {

    public KnowledgeNotConfiguredException(String message) {
        super(message);
    }

    public KnowledgeNotConfiguredException(String message, Throwable cause) {
        super(message, cause);
    }
}
