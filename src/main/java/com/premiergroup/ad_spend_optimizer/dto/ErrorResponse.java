package com.premiergroup.ad_spend_optimizer.dto;

public record ErrorResponse(
        String errorCode,
        String message
) {}
