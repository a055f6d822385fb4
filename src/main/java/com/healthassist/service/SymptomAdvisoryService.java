package com.healthassist.service;

import com.healthassist.model.dto.SymptomRequestDTO;
import com.healthassist.model.vo.HealthResponseVO;

/**
 * 症状建议服务
 */
public interface SymptomAdvisoryService {

    /**
     * 对单条症状描述生成完整建议包（饮食、病因、生活方式、危险信号、洞察、风险评估、个性化贴士）
     *
     * @param request 请求参数
     * @return 建议包，不会返回部分结果
     * @throws com.healthassist.common.exception.InvalidSymptomException 请求不合法
     * @throws com.healthassist.common.exception.AnalysisFailedException 分析过程内部异常
     */
    HealthResponseVO evaluate(SymptomRequestDTO request);
}
