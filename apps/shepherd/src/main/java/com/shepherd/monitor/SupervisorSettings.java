package com.shepherd.monitor;

import com.shepherd.config.ShepherdProperties;

import java.time.Duration;

/** Per-supervisor tuning, copied once from the bound properties. */
public record SupervisorSettings(int contextSize,
                                 int heartbeatInterval,
                                 Duration pollInterval,
                                 Duration analysisTimeout,
                                 Duration shutdownGrace,
                                 Duration backoffInitial,
                                 Duration backoffMax,
                                 double backoffMultiplier,
                                 boolean verbose) {

    public static SupervisorSettings from(ShepherdProperties props) {
        return new SupervisorSettings(
                props.getContextSize(),
                props.getHeartbeatInterval(),
                props.getPollInterval(),
                props.getAnalysis().getTimeout(),
                props.getShutdownGrace(),
                props.getBackoff().getInitial(),
                props.getBackoff().getMax(),
                props.getBackoff().getMultiplier(),
                props.isVerbose());
    }
}
