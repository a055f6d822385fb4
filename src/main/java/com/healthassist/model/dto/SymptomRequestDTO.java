package com.healthassist.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 症状分析请求参数
 * 字段名与前端 JSON 保持一致（snake_case）
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SymptomRequestDTO {

    /**
     * 症状描述 - 必填
     */
    @NotBlank(message = "Please enter a symptom to analyze")
    private String symptom;

    /**
     * 持续时间（如：2 days / 3 weeks）
     */
    private String duration = "";

    /**
     * 严重程度（如：mild / severe）
     */
    private String severity = "";

    /**
     * 补充说明
     */
    private String additional_info = "";

    /**
     * 年龄 - 可选，必须为正整数
     */
    @Positive(message = "Age must be a positive number")
    private Integer age;

    /**
     * 性别 - 可选
     */
    private String gender;

    /**
     * 既往病史 - 可选
     */
    private String medical_history;
}
