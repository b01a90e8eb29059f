package com.spreadsheet.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.functions.FunctionRegistry;
import com.spreadsheet.engine.services.EngineWorker;
import com.spreadsheet.engine.services.FormulaEngine;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Engine beans. Each injected FormulaEngine is a fresh sheet; the worker owns its own.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.withBuiltins();
    }

    @Bean
    public TypeCoercion typeCoercion() {
        return new TypeCoercion();
    }

    @Bean
    public Clock engineClock(EngineProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public FormulaEngine formulaEngine(FunctionRegistry functionRegistry, TypeCoercion typeCoercion,
                                       Clock engineClock, EngineProperties properties) {
        return new FormulaEngine(functionRegistry, typeCoercion, engineClock, properties.getLoadOrder());
    }

    @Bean(destroyMethod = "shutdown")
    public EngineWorker engineWorker(FormulaEngine formulaEngine, ObjectMapper objectMapper,
                                     EngineProperties properties) {
        return new EngineWorker(formulaEngine, objectMapper, properties.getWorkerThreadName());
    }
}
