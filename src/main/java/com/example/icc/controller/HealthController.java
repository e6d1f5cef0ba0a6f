package com.example.icc.controller;

import com.example.icc.store.IccStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final IccStore store;

    public HealthController(IccStore store) {
        this.store = store;
    }

    @GetMapping("/system/icc/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("healthy", true);
        health.put("service", "icc");

        try {
            store.ping();
            health.put("store", "UP");
        } catch (RuntimeException e) {
            health.put("store", "DOWN");
        }

        return ResponseEntity.ok(health);
    }
}
