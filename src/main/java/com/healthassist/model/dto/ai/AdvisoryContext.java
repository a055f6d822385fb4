package com.healthassist.model.dto.ai;

import com.healthassist.model.knowledge.CategoryProfile;
import com.healthassist.model.knowledge.KnowledgeEntry;
import com.healthassist.model.vo.HealthResponseVO;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 组装上下文容器
 * 汇总各分析步骤的产出，实现"规则计算"与"结果组装"分离
 */
@Data
@Builder
public class AdvisoryContext {

    private SymptomQuery query;

    // 命中的类别 key 及是否为兜底类别
    private String category;
    private boolean defaultCategory;

    private String ruleVersion;

    // 共享规则（只读）
    private CategoryProfile profile;

    // 个性化后的饮食副本
    private KnowledgeEntry personalizedDiet;

    private List<HealthResponseVO.PossibleCause> causes;
    private HealthResponseVO.RiskAssessment risk;
    private List<HealthResponseVO.AiInsight> insights;
    private List<String> tips;
}
