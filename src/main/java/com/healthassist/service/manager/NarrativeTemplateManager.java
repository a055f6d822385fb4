package com.healthassist.service.manager;

import com.healthassist.common.AdvisoryConstants;
import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.vo.HealthResponseVO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 叙述文案模板管理器
 * 职责：管理分析摘要 / 研究摘要 / 免责声明模板，只做确定性插值，
 * 文案中出现的事实必须来自请求本身或规则表查询结果
 */
@Component
public class NarrativeTemplateManager {

    private static final String NOT_SPECIFIED = "not specified";

    private static final String ANALYSIS_TEMPLATE = """
            Your symptom of '%s' has been analyzed considering duration (%s), severity (%s)%s. \
            It was matched to the %s guidance profile. \
            The highest-ranked possible cause in this profile is %s (%s). \
            Immediate risk is classified as %s and progression risk as %s.""";

    private static final String RESEARCH_TEMPLATE = """
            Guidance summary for '%s' based on rule table version %s: \
            %d possible causes were reviewed, led by %s. \
            Nutritional focus: %s. \
            %d red flag symptoms are listed that warrant prompt medical attention.""";

    public String buildSymptomAnalysis(SymptomQuery query, String category, boolean isDefault,
                                       List<HealthResponseVO.PossibleCause> causes,
                                       HealthResponseVO.RiskAssessment risk) {
        HealthResponseVO.PossibleCause primary = causes.get(0);
        return ANALYSIS_TEMPLATE.formatted(
                query.symptom(),
                orNotSpecified(query.duration()),
                orNotSpecified(query.severity()),
                describeContext(query),
                isDefault ? "general" : "'" + category + "'",
                primary.getCondition(),
                primary.getProbability(),
                risk.getImmediate_risk(),
                risk.getProgression_risk());
    }

    public String buildResearchSummary(SymptomQuery query, String version,
                                       List<HealthResponseVO.PossibleCause> causes,
                                       HealthResponseVO.DietPlan diet, List<String> redFlags) {
        return RESEARCH_TEMPLATE.formatted(
                query.symptom(),
                version,
                causes.size(),
                causes.get(0).getCondition(),
                String.join(", ", diet.getNutritional_focus()),
                redFlags.size());
    }

    public String buildDisclaimer() {
        return AdvisoryConstants.MEDICAL_DISCLAIMER;
    }

    private String describeContext(SymptomQuery query) {
        List<String> parts = new ArrayList<>();
        if (query.hasAge()) {
            parts.add("age (" + query.age() + ")");
        }
        if (StringUtils.isNotBlank(query.gender())) {
            parts.add("gender (" + query.gender().trim() + ")");
        }
        if (query.hasMedicalHistory()) {
            parts.add("medical history (" + query.medicalHistory().trim() + ")");
        }
        if (StringUtils.isNotBlank(query.additionalInfo())) {
            parts.add("additional information you provided");
        }
        return parts.isEmpty() ? "" : ", " + String.join(", ", parts);
    }

    private String orNotSpecified(String value) {
        return StringUtils.isBlank(value) ? NOT_SPECIFIED : value.trim();
    }
}
