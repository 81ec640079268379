package com.openforge.clusterlens.investigation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clusterlens.investigation.tool.ArgumentShape;
import com.openforge.clusterlens.investigation.tool.ToolCatalog;

/**
 * One entry of GET /api/investigations/tools.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolResponse(String name, String usage, ArgumentShape arguments, String description) {

    public static ToolResponse from(ToolCatalog tool) {
        return new ToolResponse(tool.name(), tool.usage(), tool.shape(), tool.description());
    }
}
