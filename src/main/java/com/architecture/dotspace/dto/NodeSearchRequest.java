package com.architecture.dotspace.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeSearchRequest {

    @NotBlank(message = "Diagram content is required")
    private String content;

    @NotBlank(message = "Search query is required")
    private String query;
}
