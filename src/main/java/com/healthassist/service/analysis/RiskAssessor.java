package com.healthassist.service.analysis;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.vo.HealthResponseVO;
import org.springframework.stereotype.Component;

/**
 * 风险评估
 * 封闭规则集：基线为低风险，严重程度与病程两条覆盖规则相互独立、可同时生效
 */
@Component
public class RiskAssessor {

    public HealthResponseVO.RiskAssessment assess(String severity, String duration) {
        HealthResponseVO.RiskAssessment risk = new HealthResponseVO.RiskAssessment();
        risk.setImmediate_risk(AdvisoryConstants.RISK_LOW);
        risk.setProgression_risk(AdvisoryConstants.RISK_LOW);
        risk.setIntervention_urgency(AdvisoryConstants.URGENCY_ROUTINE);
        risk.setFollow_up_timeline(AdvisoryConstants.FOLLOW_UP_STANDARD);
        risk.setAi_recommendation(AdvisoryConstants.RECOMMENDATION_MONITOR);

        if (AdvisoryConstants.isSevere(severity)) {
            risk.setImmediate_risk(AdvisoryConstants.RISK_MEDIUM);
            risk.setIntervention_urgency(AdvisoryConstants.URGENCY_PROMPT);
            risk.setFollow_up_timeline(AdvisoryConstants.FOLLOW_UP_SHORT);
        }

        if (AdvisoryConstants.isProlonged(duration)) {
            risk.setProgression_risk(AdvisoryConstants.RISK_MEDIUM);
            risk.setAi_recommendation(AdvisoryConstants.RECOMMENDATION_ESCALATE);
        }
        return risk;
    }
}
