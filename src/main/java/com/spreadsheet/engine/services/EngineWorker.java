package com.spreadsheet.engine.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.engine.exceptions.ErrorResponse;
import com.spreadsheet.engine.models.CellData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one {@link FormulaEngine} on its own thread and feeds it messages one at a time,
 * in submission order. Callers on any thread get a future for each reply; the engine
 * itself is never touched concurrently.
 */
public class EngineWorker {

    private static final Logger logger = LoggerFactory.getLogger(EngineWorker.class);

    private final FormulaEngine engine;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public EngineWorker(FormulaEngine engine, ObjectMapper objectMapper, String threadName) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Engine worker started on thread {}", threadName);
    }

    /**
     * Queues a request. Throws RejectedExecutionException after {@link #shutdown()}.
     */
    public CompletableFuture<WorkerResponse> submit(WorkerRequest request) {
        return CompletableFuture.supplyAsync(() -> handle(request), executor);
    }

    /**
     * JSON in, JSON out. A message that cannot be read is answered with an error reply.
     */
    public CompletableFuture<String> submitJson(String json) {
        WorkerRequest request;
        try {
            request = objectMapper.readValue(json, WorkerRequest.class);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable worker message: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(
                    toJson(WorkerResponse.error(new ErrorResponse("BAD_REQUEST", e.getOriginalMessage()))));
        }
        return submit(request).thenApply(this::toJson);
    }

    public void shutdown() {
        executor.shutdown();
        logger.info("Engine worker stopped");
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    WorkerResponse handle(WorkerRequest request) {
        WorkerRequest.Payload payload = request.getPayload() == null ? new WorkerRequest.Payload() : request.getPayload();
        String type = request.getType() == null ? "" : request.getType();
        try {
            switch (type) {
                case "load": {
                    Map<String, CellData> cells = payload.getFileCellData();
                    engine.loadData(cells == null ? Collections.emptyMap() : cells);
                    return WorkerResponse.loadComplete();
                }
                case "setFormula":
                    return WorkerResponse.updates(engine.setFormula(payload.getCellId(), payload.getFormulaString()));
                case "setCellValue":
                    return WorkerResponse.updates(engine.setCellValue(payload.getCellId(), payload.getValue()));
                case "clearCell":
                    return WorkerResponse.updates(engine.clearCell(payload.getCellId()));
                case "getCellValue":
                    return WorkerResponse.value(engine.getCellValue(payload.getCellId()));
                case "getFormulaString":
                    return WorkerResponse.formula(engine.getFormulaString(payload.getCellId()));
                default:
                    logger.warn("Unknown message type received: {}", type);
                    return WorkerResponse.error(new ErrorResponse("UNKNOWN_MESSAGE", "Unknown message type: " + type));
            }
        } catch (RuntimeException e) {
            logger.error("Error processing {}", request, e);
            return WorkerResponse.error(ErrorResponse.from(e));
        }
    }

    private String toJson(WorkerResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize worker response", e);
        }
    }
}
