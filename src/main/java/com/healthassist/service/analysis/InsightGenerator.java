package com.healthassist.service.analysis;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.vo.HealthResponseVO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 建议洞察生成
 * 固定顺序：模式分析 -> 年龄相关（仅年龄 > 40）-> 预防策略
 */
@Component
public class InsightGenerator {

    public List<HealthResponseVO.AiInsight> generate(SymptomQuery query) {
        List<HealthResponseVO.AiInsight> insights = new ArrayList<>(3);

        insights.add(insight(AdvisoryConstants.INSIGHT_PATTERN,
                "Symptom Pattern Recognition",
                String.format("Reported symptom '%s' has been compared against known symptom patterns "
                        + "to select the most relevant guidance.", query.symptom()),
                "Record when the symptom starts, how long it lasts and what seems to trigger it.",
                AdvisoryConstants.EVIDENCE_MODERATE));

        if (query.isOlderThan(AdvisoryConstants.AGE_INSIGHT_THRESHOLD)) {
            insights.add(insight(AdvisoryConstants.INSIGHT_AGE,
                    "Age-Specific Considerations",
                    String.format("At age %d, changes in blood pressure, hormones and nutrient absorption "
                            + "can influence how symptoms present.", query.age()),
                    "Discuss age-appropriate screening with your healthcare provider.",
                    AdvisoryConstants.EVIDENCE_HIGH));
        }

        insights.add(insight(AdvisoryConstants.INSIGHT_PREVENTION,
                "Preventive Strategy",
                "Consistent sleep, hydration, balanced meals and stress management reduce the recurrence "
                        + "of many common symptoms.",
                "Build the lifestyle suggestions above into a daily routine.",
                AdvisoryConstants.EVIDENCE_HIGH));
        return insights;
    }

    private HealthResponseVO.AiInsight insight(String type, String title, String description,
                                               String recommendation, String evidence) {
        HealthResponseVO.AiInsight insight = new HealthResponseVO.AiInsight();
        insight.setInsight_type(type);
        insight.setTitle(title);
        insight.setDescription(description);
        insight.setRecommendation(recommendation);
        insight.setEvidence_level(evidence);
        return insight;
    }
}
