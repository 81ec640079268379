package com.openforge.clusterlens.investigation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/investigations/{id}/questions.
 */
public record AskRequest(

        @NotBlank(message = "question must not be blank")
        @Size(max = 4000, message = "question must not exceed 4000 characters")
        String question
) {}
