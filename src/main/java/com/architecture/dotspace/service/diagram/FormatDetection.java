package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramFormat;
import lombok.Value;

/**
 * Outcome of format detection.
 */
@Value
public class FormatDetection {

    DiagramFormat format;
    boolean positiveMatch;  // false when nothing in the text pointed at a dialect and DOT was assumed
    String reason;

    public String getSourceName() {
        return format.getSourceName();
    }
}
