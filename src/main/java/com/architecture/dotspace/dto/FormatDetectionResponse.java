package com.architecture.dotspace.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatDetectionResponse {
    private String format;
    private String sourceName;
    private boolean positiveMatch;
    private String reason;
}
