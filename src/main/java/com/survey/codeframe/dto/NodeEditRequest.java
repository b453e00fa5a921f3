package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Edit of one node; only the non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeEditRequest {

    private String name;

    private String description;

    @JsonProperty("parent_id")
    private UUID parentId;

    @JsonProperty("display_order")
    private Integer displayOrder;

    @JsonProperty("edited_by")
    private String editedBy;
}
