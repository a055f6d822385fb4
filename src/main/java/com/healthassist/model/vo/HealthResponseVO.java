package com.healthassist.model.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 症状分析结果（单次请求的完整建议包）
 * 字段名即前端协议字段名，不做二次映射
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthResponseVO {

    private String symptom_analysis;
    private String ai_web_research;

    private DietPlan diet_plan;
    private List<PossibleCause> possible_causes = new ArrayList<>();
    private List<String> lifestyle_suggestions = new ArrayList<>();
    private List<String> red_flags = new ArrayList<>();
    private List<AiInsight> ai_insights = new ArrayList<>();
    private RiskAssessment risk_assessment;
    private List<String> personalized_tips = new ArrayList<>();

    private String medical_disclaimer;

    // ISO-8601，组装时刻
    private String search_timestamp;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DietPlan {
        private List<String> foods_to_consume = new ArrayList<>();
        private List<String> foods_to_avoid = new ArrayList<>();
        private List<String> nutritional_focus = new ArrayList<>();
        private List<String> meal_suggestions = new ArrayList<>();
        private List<String> supplements = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PossibleCause {
        private String condition;
        private String probability;
        private String description;
        private String urgency_level;
        private String ai_confidence;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AiInsight {
        private String insight_type;
        private String title;
        private String description;
        private String recommendation;
        private String evidence_level;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskAssessment {
        private String immediate_risk;
        private String progression_risk;
        private String intervention_urgency;
        private String follow_up_timeline;
        private String ai_recommendation;
    }
}
