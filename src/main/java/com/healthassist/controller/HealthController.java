package com.healthassist.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 服务探活接口
 */
@RestController
public class HealthController {

    @Value("${advisor.service-name:AI Health Assistant}")
    private String serviceName;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", serviceName + " API is running");
    }

    /**
     * 就绪探针，返回静态状态
     */
    @GetMapping("/api/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", serviceName);
    }
}
