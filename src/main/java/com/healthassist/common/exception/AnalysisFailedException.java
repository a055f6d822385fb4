package com.healthassist.common.exception;

/**
 * 分析过程中的内部异常，对外只暴露统一的提示文案
 */
public class AnalysisFailedException extends RuntimeException {

    public static final String OPAQUE_MESSAGE = "Unable to analyze symptom. Please try again later.";

    public AnalysisFailedException(Throwable cause) {
        super(OPAQUE_MESSAGE, cause);
    }
}
