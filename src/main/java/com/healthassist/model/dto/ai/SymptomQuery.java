package com.healthassist.model.dto.ai;

import org.apache.commons.lang3.StringUtils;

/**
 * 单次分析的不可变查询上下文
 * 由请求 DTO 校验后生成，只属于一次分析调用
 */
public record SymptomQuery(
        String symptom,
        String duration,
        String severity,
        String additionalInfo,
        Integer age,
        String gender,
        String medicalHistory) {

    public SymptomQuery {
        symptom = StringUtils.trimToEmpty(symptom);
        duration = StringUtils.defaultString(duration);
        severity = StringUtils.defaultString(severity);
        additionalInfo = StringUtils.defaultString(additionalInfo);
    }

    public boolean hasAge() {
        return age != null;
    }

    /**
     * 年龄严格大于阈值；未提供年龄时返回 false
     */
    public boolean isOlderThan(int threshold) {
        return age != null && age > threshold;
    }

    public boolean hasMedicalHistory() {
        return StringUtils.isNotBlank(medicalHistory);
    }
}
