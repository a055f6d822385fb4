package com.healthassist.model.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 规则表 JSON 文档结构（knowledge/symptom-rules.json）
 * 仅用于启动时反序列化，校验后转换为不可变的 {@link CategoryProfile}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleTableDocument {

    private String version;

    // 所有类别共享的通用生活方式建议
    private List<String> general_lifestyle;

    // 有序数组：顺序即匹配优先级
    private List<Category> categories;

    // 兜底类别，未命中任何类别时使用
    @JsonProperty("default")
    private Category defaults;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Category {
        private String key;
        private Diet diet;
        private List<Cause> causes;
        private List<String> lifestyle;
        private List<String> red_flags;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Diet {
        private List<String> foods_to_consume;
        private List<String> foods_to_avoid;
        private List<String> nutritional_focus;
        private List<String> meal_suggestions;
        private List<String> supplements;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cause {
        private String condition;
        private String probability;
        private String description;
        private String urgency;
        private String confidence;
        private AgeBranch age_branch;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgeBranch {
        private Integer threshold;
        private Estimate below;
        private Estimate at_or_above;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Estimate {
        private String probability;
        private String confidence;
    }
}
