package com.shepherd.api.dto;

import com.shepherd.monitor.SupervisorState;

public record ProjectStatus(String projectId, SupervisorState state, long messagesProcessed,
                            long alertsRaised, int activeViolations) {
}
