package com.spreadsheet.engine.services;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.engine.exceptions.ErrorResponse;
import com.spreadsheet.engine.models.UpdateSet;
import com.spreadsheet.engine.values.Value;

/**
 * Reply from the {@link EngineWorker}. Only the fields of its type are set:
 * - loadComplete: nothing
 * - updates: { "type": "updates", "updates": { "B1": 20, "C1": "#DIV/0!" } }
 * - value: the cell's value, and its formula text for getFormulaString
 * - error: { "type": "error", "error": { "code": "...", "message": "..." } }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkerResponse {
    public static final String LOAD_COMPLETE = "loadComplete";
    public static final String UPDATES = "updates";
    public static final String VALUE = "value";
    public static final String ERROR = "error";

    private final String type;
    private UpdateSet updates;
    private Value value;
    private String formula;
    private ErrorResponse error;

    private WorkerResponse(String type) {
        this.type = type;
    }

    public static WorkerResponse loadComplete() {
        return new WorkerResponse(LOAD_COMPLETE);
    }

    public static WorkerResponse updates(UpdateSet updates) {
        WorkerResponse response = new WorkerResponse(UPDATES);
        response.updates = updates;
        return response;
    }

    public static WorkerResponse value(Value value) {
        WorkerResponse response = new WorkerResponse(VALUE);
        response.value = value;
        return response;
    }

    public static WorkerResponse formula(String formula) {
        WorkerResponse response = new WorkerResponse(VALUE);
        response.formula = formula;
        return response;
    }

    public static WorkerResponse error(ErrorResponse error) {
        WorkerResponse response = new WorkerResponse(ERROR);
        response.error = error;
        return response;
    }

    public String getType() {
        return type;
    }

    public UpdateSet getUpdates() {
        return updates;
    }

    public Value getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public ErrorResponse getError() {
        return error;
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR.equals(type);
    }
}
