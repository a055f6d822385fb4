package com.healthassist.service.analysis;

import com.healthassist.service.knowledge.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 症状类别匹配器
 * 纯子串包含匹配：按知识库声明顺序逐个检查，首个命中即返回，全部未命中返回兜底类别
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SymptomMatcher {

    private final KnowledgeBase knowledgeBase;

    public String resolve(String symptomText) {
        String lower = symptomText == null ? "" : symptomText.toLowerCase(Locale.ROOT);
        for (String key : knowledgeBase.categoryKeys()) {
            if (lower.contains(key)) {
                return key;
            }
        }
        log.debug("症状未命中任何类别，使用兜底规则: {}", symptomText);
        return KnowledgeBase.DEFAULT_KEY;
    }
}
