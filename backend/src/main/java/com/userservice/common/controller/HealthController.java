package com.userservice.common.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private static final Map<String, String> HEALTH_RESPONSE = Map.of("status", "ok");

    @GetMapping("/health")
    public Map<String, String> health() {
        return HEALTH_RESPONSE;
    }
}
