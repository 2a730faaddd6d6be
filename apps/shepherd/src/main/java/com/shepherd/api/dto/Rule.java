package com.shepherd.api.dto;

public record Rule(String id, String description) {
}
