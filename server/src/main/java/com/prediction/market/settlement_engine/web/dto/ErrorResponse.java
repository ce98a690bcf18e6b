package com.prediction.market.settlement_engine.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String code, String kind, String message, String retryToken) {
}
