package com.architecture.dotspace.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeSearchResponse {
    private String query;
    private int matchCount;
    private List<String> matches;   // node keys in declaration order
}
