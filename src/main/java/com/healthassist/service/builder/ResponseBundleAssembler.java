package com.healthassist.service.builder;

import com.healthassist.model.dto.ai.AdvisoryContext;
import com.healthassist.model.knowledge.KnowledgeEntry;
import com.healthassist.model.vo.HealthResponseVO;
import com.healthassist.service.manager.NarrativeTemplateManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;

/**
 * 结果组装器
 * 除时间戳外为纯计算；时间只从注入的 Clock 读取一次
 */
@Component
@RequiredArgsConstructor
public class ResponseBundleAssembler {

    private final NarrativeTemplateManager narrativeTemplateManager;
    private final Clock clock;

    public HealthResponseVO assemble(AdvisoryContext ctx) {
        HealthResponseVO vo = new HealthResponseVO();

        HealthResponseVO.DietPlan diet = toDietPlan(ctx.getPersonalizedDiet());
        vo.setDiet_plan(diet);
        vo.setPossible_causes(new ArrayList<>(ctx.getCauses()));
        vo.setLifestyle_suggestions(new ArrayList<>(ctx.getProfile().lifestyle()));
        vo.setRed_flags(new ArrayList<>(ctx.getProfile().redFlags()));
        vo.setAi_insights(new ArrayList<>(ctx.getInsights()));
        vo.setRisk_assessment(ctx.getRisk());
        vo.setPersonalized_tips(new ArrayList<>(ctx.getTips()));

        vo.setSymptom_analysis(narrativeTemplateManager.buildSymptomAnalysis(
                ctx.getQuery(), ctx.getCategory(), ctx.isDefaultCategory(), ctx.getCauses(), ctx.getRisk()));
        vo.setAi_web_research(narrativeTemplateManager.buildResearchSummary(
                ctx.getQuery(), ctx.getRuleVersion(), ctx.getCauses(), diet, ctx.getProfile().redFlags()));
        vo.setMedical_disclaimer(narrativeTemplateManager.buildDisclaimer());

        vo.setSearch_timestamp(OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        return vo;
    }

    private HealthResponseVO.DietPlan toDietPlan(KnowledgeEntry entry) {
        HealthResponseVO.DietPlan diet = new HealthResponseVO.DietPlan();
        diet.setFoods_to_consume(new ArrayList<>(entry.foodsToConsume()));
        diet.setFoods_to_avoid(new ArrayList<>(entry.foodsToAvoid()));
        diet.setNutritional_focus(new ArrayList<>(entry.nutritionalFocus()));
        diet.setMeal_suggestions(new ArrayList<>(entry.mealSuggestions()));
        diet.setSupplements(new ArrayList<>(entry.supplements()));
        return diet;
    }
}
