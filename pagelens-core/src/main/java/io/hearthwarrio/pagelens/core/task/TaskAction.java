package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handler for one task {@code action}.
 */
@FunctionalInterface
public interface TaskAction {

    /**
     * @return the {@code result} of the task
     * @throws Exception any failure; the executor maps it to a structured error
     */
    JsonNode run(ActionContext context) throws Exception;
}
