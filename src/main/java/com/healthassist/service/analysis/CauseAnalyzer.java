package com.healthassist.service.analysis;

import com.healthassist.model.dto.ai.SymptomQuery;
import com.healthassist.model.knowledge.CauseEntry;
import com.healthassist.model.vo.HealthResponseVO;
import com.healthassist.service.knowledge.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 可能病因分析
 * 按规则表顺序输出（顺序即排名），带年龄分支的条目根据年龄阈值选择概率/置信度
 */
@Component
@RequiredArgsConstructor
public class CauseAnalyzer {

    private final KnowledgeBase knowledgeBase;

    public List<HealthResponseVO.PossibleCause> causes(String category, SymptomQuery query) {
        return knowledgeBase.profile(category).causes().stream()
                .map(cause -> toPossibleCause(cause, query))
                .toList();
    }

    private HealthResponseVO.PossibleCause toPossibleCause(CauseEntry cause, SymptomQuery query) {
        String probability = cause.probability();
        String confidence = cause.confidence();

        // 未提供年龄时沿用条目的静态取值
        if (cause.ageBranch() != null && query.hasAge()) {
            CauseEntry.Estimate estimate = cause.ageBranch().select(query.age());
            probability = estimate.probability();
            confidence = estimate.confidence();
        }

        HealthResponseVO.PossibleCause vo = new HealthResponseVO.PossibleCause();
        vo.setCondition(cause.condition());
        vo.setProbability(probability);
        vo.setDescription(cause.description());
        vo.setUrgency_level(cause.urgency());
        vo.setAi_confidence(confidence);
        return vo;
    }
}
