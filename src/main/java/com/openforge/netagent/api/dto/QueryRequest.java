package com.openforge.netagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/network/query.
 *
 * @param query          the natural-language question
 * @param conversationId optional; omitted starts a new conversation
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record QueryRequest(

        @NotBlank(message = "query must not be blank")
        @Size(max = 4000, message = "query must not exceed 4000 characters")
        String query,

        String conversationId
) {}
