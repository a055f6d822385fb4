package com.healthassist.service.analysis;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.vo.HealthResponseVO;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InsightGeneratorTest {

    private final InsightGenerator generator = new InsightGenerator();

    private static SymptomQuery query(Integer age) {
        return new SymptomQuery("dizziness", "", "", "", age, null, null);
    }

    @Test
    void threeInsightsAboveForty() {
        List<HealthResponseVO.AiInsight> insights = generator.generate(query(41));

        assertThat(insights).extracting(HealthResponseVO.AiInsight::getInsight_type)
                .containsExactly(AdvisoryConstants.INSIGHT_PATTERN, AdvisoryConstants.INSIGHT_AGE,
                        AdvisoryConstants.INSIGHT_PREVENTION);
        assertThat(insights.get(1).getDescription()).contains("41");
    }

    @Test
    void twoInsightsAtFortyOrWithoutAge() {
        for (Integer age : new Integer[]{40, 25, null}) {
            List<HealthResponseVO.AiInsight> insights = generator.generate(query(age));

            assertThat(insights).extracting(HealthResponseVO.AiInsight::getInsight_type)
                    .containsExactly(AdvisoryConstants.INSIGHT_PATTERN, AdvisoryConstants.INSIGHT_PREVENTION);
        }
    }

    @Test
    void patternInsightMentionsSymptom() {
        HealthResponseVO.AiInsight pattern = generator.generate(query(null)).get(0);

        assertThat(pattern.getDescription()).contains("'dizziness'");
        assertThat(pattern.getEvidence_level()).isEqualTo(AdvisoryConstants.EVIDENCE_MODERATE);
    }
}
