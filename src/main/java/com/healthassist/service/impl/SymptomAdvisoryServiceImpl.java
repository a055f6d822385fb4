package com.healthassist.service.impl;

import com.healthassist.common.exception.AnalysisFailedException;
import com.healthassist.common.exception.InvalidSymptomException;
import com.healthassist.model.dto.SymptomRequestDTO;
import com.healthassist.model.dto.ai.AdvisoryContext;
import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.knowledge.CategoryProfile;
import com.healthassist.model.knowledge.KnowledgeEntry;
import com.healthassist.model.vo.HealthResponseVO;
import com.healthassist.service.SymptomAdvisoryService;
import com.healthassist.service.analysis.CauseAnalyzer;
import com.healthassist.service.analysis.InsightGenerator;
import com.healthassist.service.analysis.RiskAssessor;
import com.healthassist.service.analysis.SymptomMatcher;
import com.healthassist.service.builder.DietPersonalizer;
import com.healthassist.service.builder.ResponseBundleAssembler;
import com.healthassist.service.knowledge.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 症状建议实现
 * 采用 类别匹配 -> 规则计算（个性化/病因/风险/洞察）-> 结果组装 的三层架构
 * 无共享可变状态，可任意并发调用
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SymptomAdvisoryServiceImpl implements SymptomAdvisoryService {

    private final KnowledgeBase knowledgeBase;
    private final SymptomMatcher symptomMatcher;         // Step 1: 类别匹配
    private final DietPersonalizer dietPersonalizer;     // Step 2: 个性化
    private final CauseAnalyzer causeAnalyzer;
    private final RiskAssessor riskAssessor;
    private final InsightGenerator insightGenerator;
    private final ResponseBundleAssembler responseBundleAssembler; // Step 3: 组装

    @Value("${advisor.symptom.max-length:500}")
    private int maxSymptomLength = 500;

    @Override
    public HealthResponseVO evaluate(SymptomRequestDTO request) {
        SymptomQuery query = toQuery(request);
        log.debug("开始分析症状: {}", query.symptom());

        try {
            HealthResponseVO response = analyze(query);
            log.debug("症状分析完成: {}", query.symptom());
            return response;
        } catch (RuntimeException e) {
            log.error("症状分析失败: {}", query.symptom(), e);
            throw new AnalysisFailedException(e);
        }
    }

    private HealthResponseVO analyze(SymptomQuery query) {
        String category = symptomMatcher.resolve(query.symptom());
        CategoryProfile profile = knowledgeBase.profile(category);
        log.info("症状 '{}' 命中类别 {}", query.symptom(), category);

        KnowledgeEntry personalized = dietPersonalizer.personalize(profile.diet(), query);

        AdvisoryContext context = AdvisoryContext.builder()
                .query(query)
                .category(category)
                .defaultCategory(knowledgeBase.isDefault(category))
                .ruleVersion(knowledgeBase.version())
                .profile(profile)
                .personalizedDiet(personalized)
                .causes(causeAnalyzer.causes(category, query))
                .risk(riskAssessor.assess(query.severity(), query.duration()))
                .insights(insightGenerator.generate(query))
                .tips(dietPersonalizer.tips(query))
                .build();

        return responseBundleAssembler.assemble(context);
    }

    /**
     * 校验请求并转换为不可变查询
     */
    private SymptomQuery toQuery(SymptomRequestDTO request) {
        if (request == null) {
            throw new InvalidSymptomException("Request body is required");
        }
        String symptom = StringUtils.trimToEmpty(request.getSymptom());
        if (symptom.isEmpty()) {
            throw new InvalidSymptomException("Please enter a symptom to analyze");
        }
        if (symptom.length() > maxSymptomLength) {
            throw new InvalidSymptomException("Symptom description must not exceed " + maxSymptomLength + " characters");
        }
        if (symptom.chars().noneMatch(Character::isLetterOrDigit)) {
            throw new InvalidSymptomException("Symptom description must contain letters or digits");
        }
        if (request.getAge() != null && request.getAge() <= 0) {
            throw new InvalidSymptomException("Age must be a positive number");
        }
        return new SymptomQuery(symptom,
                request.getDuration(),
                request.getSeverity(),
                request.getAdditional_info(),
                request.getAge(),
                request.getGender(),
                request.getMedical_history());
    }
}
