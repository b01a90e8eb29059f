package com.spreadsheet.engine.config;

import com.spreadsheet.engine.models.LoadOrder;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under "formula.engine":
 * - load-order: LENGTH (default) or TOPOLOGICAL
 * - time-zone: zone TODAY() and NOW() read the wall clock in (default UTC)
 * - worker-thread-name: name of the engine worker thread
 */
@ConfigurationProperties(prefix = "formula.engine")
public class EngineProperties {
    private LoadOrder loadOrder = LoadOrder.LENGTH;
    private String timeZone = "UTC";
    private String workerThreadName = "formula-worker";

    public LoadOrder getLoadOrder() {
        return loadOrder;
    }

    public void setLoadOrder(LoadOrder loadOrder) {
        this.loadOrder = loadOrder;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public String getWorkerThreadName() {
        return workerThreadName;
    }

    public void setWorkerThreadName(String workerThreadName) {
        this.workerThreadName = workerThreadName;
    }
}
