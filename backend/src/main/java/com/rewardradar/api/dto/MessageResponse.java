package com.rewardradar.api.dto;

public record MessageResponse(String message) {
}
