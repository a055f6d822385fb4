package com.healthassist.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthassist.model.dto.SymptomRequestDTO;
import com.healthassist.service.analysis.CauseAnalyzer;
import com.healthassist.service.analysis.InsightGenerator;
import com.healthassist.service.analysis.RiskAssessor;
import com.healthassist.service.analysis.SymptomMatcher;
import com.healthassist.service.builder.DietPersonalizer;
import com.healthassist.service.builder.ResponseBundleAssembler;
import com.healthassist.service.impl.SymptomAdvisoryServiceImpl;
import com.healthassist.service.knowledge.KnowledgeBase;
import com.healthassist.service.manager.NarrativeTemplateManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 不依赖 Spring 容器，手工装配规则引擎
 */
public final class EngineFixtures {

    public static final String RULES = "knowledge/symptom-rules.json";

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-01T08:30:00Z"), ZoneOffset.UTC);

    private EngineFixtures() {
    }

    public static KnowledgeBase knowledgeBase() {
        return new KnowledgeBase(new ObjectMapper(), RULES);
    }

    public static SymptomAdvisoryServiceImpl service(KnowledgeBase kb, Clock clock) {
        return new SymptomAdvisoryServiceImpl(kb,
                new SymptomMatcher(kb),
                new DietPersonalizer(),
                new CauseAnalyzer(kb),
                new RiskAssessor(),
                new InsightGenerator(),
                new ResponseBundleAssembler(new NarrativeTemplateManager(), clock));
    }

    public static SymptomRequestDTO request(String symptom) {
        SymptomRequestDTO request = new SymptomRequestDTO();
        request.setSymptom(symptom);
        return request;
    }

    public static SymptomRequestDTO request(String symptom, Integer age, String gender) {
        SymptomRequestDTO request = request(symptom);
        request.setAge(age);
        request.setGender(gender);
        return request;
    }
}
