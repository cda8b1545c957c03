package com.planwright.plan;

import java.nio.file.Path;

/**
 * Turns a plan document into task records. Dependencies must already be resolved
 * to task ids; structural validation is left to the dependency graph builder.
 */
public interface PlanDocumentParser {

    /**
     * @throws PlanFormatException when the document cannot be read as a plan
     */
    ParsedPlan parse(Path document);
}
