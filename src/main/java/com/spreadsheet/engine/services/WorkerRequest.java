package com.spreadsheet.engine.services;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spreadsheet.engine.models.CellData;

import java.util.Map;

/**
 * A message for the {@link EngineWorker}, e.g.
 * { "type": "setFormula", "payload": { "cellId": "B1", "formulaString": "=A1*2" } }.
 *
 * Types: load, setFormula, setCellValue, clearCell, getCellValue, getFormulaString.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerRequest {
    private String type;
    private Payload payload = new Payload();

    // Default constructor needed for JSON (de)serialization
    public WorkerRequest() {
    }

    public WorkerRequest(String type, Payload payload) {
        this.type = type;
        this.payload = payload;
    }

    public static WorkerRequest load(Map<String, CellData> fileCellData) {
        Payload payload = new Payload();
        payload.setFileCellData(fileCellData);
        return new WorkerRequest("load", payload);
    }

    public static WorkerRequest setFormula(String cellId, String formulaString) {
        Payload payload = Payload.forCell(cellId);
        payload.setFormulaString(formulaString);
        return new WorkerRequest("setFormula", payload);
    }

    public static WorkerRequest setCellValue(String cellId, String value) {
        Payload payload = Payload.forCell(cellId);
        payload.setValue(value);
        return new WorkerRequest("setCellValue", payload);
    }

    public static WorkerRequest clearCell(String cellId) {
        return new WorkerRequest("clearCell", Payload.forCell(cellId));
    }

    public static WorkerRequest getCellValue(String cellId) {
        return new WorkerRequest("getCellValue", Payload.forCell(cellId));
    }

    public static WorkerRequest getFormulaString(String cellId) {
        return new WorkerRequest("getFormulaString", Payload.forCell(cellId));
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Payload getPayload() {
        return payload;
    }

    public void setPayload(Payload payload) {
        this.payload = payload;
    }

    @Override
    public String toString() {
        return type + (payload == null || payload.getCellId() == null ? "" : " " + payload.getCellId());
    }

    /**
     * Union of the fields the message types use; each type reads its own.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private Map<String, CellData> fileCellData;
        private String cellId;
        private String formulaString;
        private String value;

        static Payload forCell(String cellId) {
            Payload payload = new Payload();
            payload.setCellId(cellId);
            return payload;
        }

        public Map<String, CellData> getFileCellData() {
            return fileCellData;
        }

        public void setFileCellData(Map<String, CellData> fileCellData) {
            this.fileCellData = fileCellData;
        }

        public String getCellId() {
            return cellId;
        }

        public void setCellId(String cellId) {
            this.cellId = cellId;
        }

        public String getFormulaString() {
            return formulaString;
        }

        public void setFormulaString(String formulaString) {
            this.formulaString = formulaString;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }
}
