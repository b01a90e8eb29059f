package com.spreadsheet.engine.exceptions;

/**
 * Simple DTO to structure worker error replies with a code and message.
 * For example:
 * {
 *   "code": "INVALID_CELL_REFERENCE",
 *   "message": "Invalid cell reference: 1A"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    // Default constructor needed for JSON (de)serialization
    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Maps an exception thrown while serving a request to its reply code.
     */
    public static ErrorResponse from(Exception ex) {
        if (ex instanceof InvalidCellReferenceException) {
            return new ErrorResponse("INVALID_CELL_REFERENCE", ex.getMessage());
        }
        if (ex instanceof CircularReferenceException) {
            return new ErrorResponse("CIRCULAR_REFERENCE", ex.getMessage());
        }
        if (ex instanceof IllegalArgumentException) {
            return new ErrorResponse("BAD_REQUEST", ex.getMessage());
        }
        // Catch-all for anything we haven't explicitly classified
        return new ErrorResponse("SERVER_ERROR", ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
