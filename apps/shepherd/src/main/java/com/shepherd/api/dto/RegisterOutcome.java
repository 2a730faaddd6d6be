package com.shepherd.api.dto;

public enum RegisterOutcome {
    NEW,        // 首次出现，需要告警
    DUPLICATE   // 窗口内已存在，只刷新 lastSeen
}
