package com.healthassist.model.knowledge;

import java.util.List;

/**
 * 一个症状类别的完整规则：饮食、病因、生活方式、危险信号
 */
public record CategoryProfile(
        String key,
        KnowledgeEntry diet,
        List<CauseEntry> causes,
        List<String> lifestyle,
        List<String> redFlags) {

    public CategoryProfile {
        causes = List.copyOf(causes);
        lifestyle = List.copyOf(lifestyle);
        redFlags = List.copyOf(redFlags);
    }
}
