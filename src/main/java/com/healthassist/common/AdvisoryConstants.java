package com.healthassist.common;

import java.util.Locale;
import java.util.Set;

/**
 * 建议引擎常量定义
 * 风险评估、洞察、个性化规则共用同一套封闭词表，前端按原文展示
 */
public class AdvisoryConstants {

    // ===================== 风险等级 Risk Levels =====================
    public static final String RISK_LOW = "Low";
    public static final String RISK_MEDIUM = "Medium";

    // ===================== 干预紧迫度 Intervention Urgency =====================
    public static final String URGENCY_ROUTINE = "Routine";
    public static final String URGENCY_PROMPT = "Prompt (within 48 hours)";

    // ===================== 随访周期 Follow-up Timeline =====================
    public static final String FOLLOW_UP_STANDARD = "1-2 weeks";
    public static final String FOLLOW_UP_SHORT = "3-5 days";

    // ===================== 风险建议文案 =====================
    public static final String RECOMMENDATION_MONITOR =
            "Monitor your symptoms and follow the dietary and lifestyle recommendations provided.";
    public static final String RECOMMENDATION_ESCALATE =
            "Symptoms that persist for weeks or longer should be evaluated by a healthcare professional.";

    // ===================== 洞察类型 Insight Types =====================
    public static final String INSIGHT_PATTERN = "Pattern Analysis";
    public static final String INSIGHT_AGE = "Age-Related Factors";
    public static final String INSIGHT_PREVENTION = "Prevention";

    // ===================== 证据等级 Evidence Levels =====================
    public static final String EVIDENCE_MODERATE = "Moderate";
    public static final String EVIDENCE_HIGH = "High";

    /**
     * 视为"严重"的程度描述（忽略大小写）
     */
    public static final Set<String> SEVERE_LEVELS = Set.of("severe", "very severe");

    /**
     * 视为"持续较久"的病程关键字（忽略大小写，子串匹配）
     */
    public static final Set<String> PROLONGED_DURATION_MARKERS = Set.of("weeks", "month");

    /**
     * 洞察中"年龄相关"条目的触发年龄（严格大于）
     */
    public static final int AGE_INSIGHT_THRESHOLD = 40;

    /**
     * 补钙 / 维生素D 个性化规则的触发年龄（严格大于）
     */
    public static final int SENIOR_AGE_THRESHOLD = 50;

    public static final String GENDER_FEMALE = "female";

    public static final String MEDICAL_DISCLAIMER = "IMPORTANT MEDICAL DISCLAIMER: This information is for educational "
            + "purposes only and is not a substitute for professional medical advice, diagnosis, or treatment. "
            + "Always seek the advice of your physician or other qualified health provider with any questions you "
            + "may have regarding a medical condition. Never disregard professional medical advice or delay in "
            + "seeking it because of information provided here. If you experience any red flag symptoms listed "
            + "above, seek immediate medical attention.";

    /**
     * 判断程度描述是否属于"严重"
     */
    public static boolean isSevere(String severity) {
        return severity != null && SEVERE_LEVELS.contains(severity.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 判断病程描述是否表示持续较久
     */
    public static boolean isProlonged(String duration) {
        if (duration == null) {
            return false;
        }
        String lower = duration.toLowerCase(Locale.ROOT);
        return PROLONGED_DURATION_MARKERS.stream().anyMatch(lower::contains);
    }
}
