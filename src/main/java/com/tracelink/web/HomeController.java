package com.tracelink.web;

import com.tracelink.logging.LogCorrelator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HomeController {

    private final LogCorrelator correlator;

    public HomeController(LogCorrelator correlator) {
        this.correlator = correlator;
    }

    @GetMapping("/")
    public Map<String, String> home() {
        correlator.info("Home page requested", LogCorrelator.fields("endpoint", "/"));
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Hello from test-app!");
        body.put("tip", "Check Grafana to see traces, logs, and metrics");
        return body;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
