package com.healthassist.controller;

import com.healthassist.model.dto.SymptomRequestDTO;
import com.healthassist.model.vo.HealthResponseVO;
import com.healthassist.service.SymptomAdvisoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 症状分析接口
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SymptomController {

    private final SymptomAdvisoryService symptomAdvisoryService;

    /**
     * 分析症状并返回建议包
     * POST /api/analyze-symptom
     */
    @PostMapping("/analyze-symptom")
    public HealthResponseVO analyzeSymptom(@RequestBody @Validated SymptomRequestDTO request) {
        return symptomAdvisoryService.evaluate(request);
    }
}
