package com.shepherd.api.dto;

import java.util.List;

/** Everything one analysis round needs; built by the supervisor, read-only afterwards. */
public record AnalysisRequest(String projectId, RuleSet ruleSet, ContextSnapshot snapshot, List<Violation> alreadyReported) {

    public AnalysisRequest {
        alreadyReported = (alreadyReported == null) ? List.of() : List.copyOf(alreadyReported);
    }

    public Message latest() { return snapshot.latest(); }
}
