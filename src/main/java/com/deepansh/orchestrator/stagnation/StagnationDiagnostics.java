package com.deepansh.orchestrator.stagnation;

import java.util.List;
import java.util.Map;

public record StagnationDiagnostics(
        List<String> recentCalls,
        Map<String, Long> callFrequency,
        double successRate
) {}
