package com.leyesmx.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.leyesmx.domain.statute.model.ParseIssue;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        List<ParseIssue> issues
) {
    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }
}
