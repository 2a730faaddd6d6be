package com.shepherd.monitor;

public enum SupervisorState {
    WAITING_LOGS,   // 日志还未出现
    IDLE,
    ANALYZING,      // 有一个分析调用在途
    ERROR_BACKOFF,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
