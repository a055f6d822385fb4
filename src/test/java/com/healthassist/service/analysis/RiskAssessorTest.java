package com.healthassist.service.analysis;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.vo.HealthResponseVO;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskAssessorTest {

    private final RiskAssessor assessor = new RiskAssessor();

    @Test
    void baselineForUnrecognizedValues() {
        HealthResponseVO.RiskAssessment risk = assessor.assess("moderate", "2 days");

        assertThat(risk.getImmediate_risk()).isEqualTo("Low");
        assertThat(risk.getProgression_risk()).isEqualTo("Low");
        assertThat(risk.getIntervention_urgency()).isEqualTo("Routine");
        assertThat(risk.getFollow_up_timeline()).isEqualTo("1-2 weeks");
        assertThat(risk.getAi_recommendation()).isEqualTo(AdvisoryConstants.RECOMMENDATION_MONITOR);
    }

    @Test
    void severeEscalatesImmediateRiskOnly() {
        HealthResponseVO.RiskAssessment risk = assessor.assess("severe", "2 days");

        assertThat(risk.getImmediate_risk()).isEqualTo("Medium");
        assertThat(risk.getProgression_risk()).isEqualTo("Low");
        assertThat(risk.getIntervention_urgency()).isEqualTo("Prompt (within 48 hours)");
        assertThat(risk.getFollow_up_timeline()).isEqualTo("3-5 days");
        assertThat(risk.getAi_recommendation()).isEqualTo(AdvisoryConstants.RECOMMENDATION_MONITOR);
    }

    @Test
    void prolongedDurationEscalatesProgressionOnly() {
        HealthResponseVO.RiskAssessment risk = assessor.assess("mild", "3 weeks");

        assertThat(risk.getImmediate_risk()).isEqualTo("Low");
        assertThat(risk.getProgression_risk()).isEqualTo("Medium");
        assertThat(risk.getIntervention_urgency()).isEqualTo("Routine");
        assertThat(risk.getAi_recommendation()).isEqualTo(AdvisoryConstants.RECOMMENDATION_ESCALATE);
    }

    @Test
    void bothOverridesApplyTogether() {
        HealthResponseVO.RiskAssessment risk = assessor.assess("severe", "1 month");

        assertThat(risk.getImmediate_risk()).isEqualTo("Medium");
        assertThat(risk.getProgression_risk()).isEqualTo("Medium");
        assertThat(risk.getFollow_up_timeline()).isEqualTo("3-5 days");
        assertThat(risk.getAi_recommendation()).isEqualTo(AdvisoryConstants.RECOMMENDATION_ESCALATE);
    }

    @Test
    void matchingIsCaseInsensitive() {
        HealthResponseVO.RiskAssessment risk = assessor.assess(" Very Severe ", "Several MONTHS");

        assertThat(risk.getImmediate_risk()).isEqualTo("Medium");
        assertThat(risk.getProgression_risk()).isEqualTo("Medium");
    }

    @Test
    void singleWeekAndBlankInputsStayAtBaseline() {
        HealthResponseVO.RiskAssessment risk = assessor.assess("", "1 week");

        assertThat(risk.getImmediate_risk()).isEqualTo("Low");
        assertThat(risk.getProgression_risk()).isEqualTo("Low");

        HealthResponseVO.RiskAssessment nulls = assessor.assess(null, null);
        assertThat(nulls.getImmediate_risk()).isEqualTo("Low");
        assertThat(nulls.getProgression_risk()).isEqualTo("Low");
    }
}
