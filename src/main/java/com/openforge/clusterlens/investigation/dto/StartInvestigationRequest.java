package com.openforge.clusterlens.investigation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/investigations.
 *
 * @param kind      resource kind, e.g. "Pod" or "Deployment"
 * @param namespace blank for cluster-scoped kinds
 * @param name      resource name
 */
public record StartInvestigationRequest(

        @NotBlank(message = "kind must not be blank")
        String kind,

        @Size(max = 253, message = "namespace must not exceed 253 characters")
        String namespace,

        @NotBlank(message = "name must not be blank")
        @Size(max = 253, message = "name must not exceed 253 characters")
        String name
) {}
