package com.spreadsheet.engine.services;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.evaluation.Evaluator;
import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.functions.FunctionRegistry;
import com.spreadsheet.engine.graph.DependencyExtractor;
import com.spreadsheet.engine.graph.DependencyGraph;
import com.spreadsheet.engine.models.CellData;
import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellRecord;
import com.spreadsheet.engine.models.LoadOrder;
import com.spreadsheet.engine.models.UpdateSet;
import com.spreadsheet.engine.parser.Parser;
import com.spreadsheet.engine.parser.ast.AstNode;
import com.spreadsheet.engine.values.ErrorType;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Main entry point of the engine: owns the cell store and the dependency graph
 * and is the only thing that mutates either.
 *
 * Every mutation returns an {@link UpdateSet} holding the edited cell and every
 * recalculated dependent. Instances are not thread-safe; hosts serialize calls
 * (see {@link EngineWorker}).
 */
public class FormulaEngine {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEngine.class);

    private final Map<CellId, CellRecord> cells = new HashMap<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();
    private final FunctionRegistry functionRegistry;
    private final TypeCoercion coercion;
    private final LoadOrder loadOrder;
    private final Evaluator evaluator;

    public FormulaEngine() {
        this(FunctionRegistry.withBuiltins(), new TypeCoercion(), Clock.systemUTC(), LoadOrder.LENGTH);
    }

    public FormulaEngine(FunctionRegistry functionRegistry, TypeCoercion coercion, Clock clock, LoadOrder loadOrder) {
        this.functionRegistry = functionRegistry;
        this.coercion = coercion;
        this.loadOrder = loadOrder;
        this.evaluator = new Evaluator(
                new EvalContext(this::getCellValue, this::getRangeValues, functionRegistry, coercion, clock));
    }

    /**
     * Sets a cell's content from what the user typed:
     * 1) Text not starting with "=" is stored as a raw value.
     * 2) The same formula as before is a no-op returning the cached value.
     * 3) A formula that does not parse is stored as #NAME? "Syntax Error".
     * 4) A formula that would close a cycle is stored as #REF! "Circular dependency";
     *    its dependents are not touched.
     * 5) Otherwise it is evaluated, committed, and everything downstream recalculated.
     */
    public UpdateSet setFormula(String cellId, String text) {
        CellId cell = CellId.parse(cellId);
        if (text == null || !text.startsWith("=")) {
            return setCellValue(cell, coercion.parseInput(text));
        }

        CellRecord existing = cells.get(cell);
        if (existing != null && text.equals(existing.getFormula())) {
            return UpdateSet.of(cell, existing.getValue());
        }

        AstNode ast;
        try {
            ast = Parser.parseFormula(text.substring(1));
        } catch (FormulaParseException e) {
            logger.warn("Syntax error in {} at position {}: {}", cell, e.getPosition(), e.getMessage());
            return reject(cell, text, new FormulaError(ErrorType.NAME, "Syntax Error"));
        }

        Set<CellId> dependencies = DependencyExtractor.extract(ast);
        if (dependencyGraph.checkForCircularReference(cell, dependencies)) {
            logger.warn("Rejected circular formula in {}", cell);
            return reject(cell, text, new FormulaError(ErrorType.REF, "Circular dependency"));
        }
        dependencyGraph.updateDependencies(cell, dependencies);

        Value value = evaluator.evaluate(ast);
        cells.put(cell, new CellRecord(text, value, ast, dependencies));
        logger.debug("Set formula {} {} -> {}", cell, text, value);

        UpdateSet updates = recalculateDependents(cell);
        updates.put(cell, value);
        return updates;
    }

    /**
     * Stores raw input (number, TRUE/FALSE or text), replacing any formula.
     */
    public UpdateSet setCellValue(String cellId, String raw) {
        return setCellValue(CellId.parse(cellId), coercion.parseInput(raw));
    }

    public UpdateSet setCellValue(String cellId, Value value) {
        return setCellValue(CellId.parse(cellId), value);
    }

    /**
     * Stores a value, replacing any formula, and recalculates dependents.
     * An empty value leaves the cell empty.
     */
    public UpdateSet setCellValue(CellId cell, Value value) {
        Value stored = coercion.scalar(value == null ? Value.empty() : value);
        dependencyGraph.clear(cell);
        if (stored.isEmpty()) {
            cells.remove(cell);
        } else {
            cells.put(cell, CellRecord.raw(stored));
        }
        UpdateSet updates = recalculateDependents(cell);
        updates.put(cell, stored);
        return updates;
    }

    /**
     * Empties a cell. Dependents are recalculated and see a blank.
     */
    public UpdateSet clearCell(String cellId) {
        CellId cell = CellId.parse(cellId);
        dependencyGraph.clear(cell);
        cells.remove(cell);
        UpdateSet updates = recalculateDependents(cell);
        updates.put(cell, Value.empty());
        return updates;
    }

    /**
     * Replaces all state with a saved sheet: raw values first, without recalculation,
     * then every formula through {@link #setFormula} in the configured load order.
     */
    public void loadData(Map<String, CellData> data) {
        cells.clear();
        dependencyGraph.reset();

        Map<CellId, String> formulas = new LinkedHashMap<>();
        for (Map.Entry<String, CellData> entry : data.entrySet()) {
            CellId cell = CellId.parse(entry.getKey());
            CellData cellData = entry.getValue();
            if (cellData == null) {
                continue;
            }
            if (cellData.isFormula() && cellData.getValue() != null) {
                formulas.put(cell, cellData.getValue());
            } else {
                Value value = coercion.parseInput(cellData.getValue());
                if (!value.isEmpty()) {
                    cells.put(cell, CellRecord.raw(value));
                }
            }
        }

        List<CellId> order = loadOrder == LoadOrder.TOPOLOGICAL
                ? topologicalOrder(formulas)
                : byLength(formulas, new ArrayList<>(formulas.keySet()));
        for (CellId cell : order) {
            setFormula(cell.toString(), formulas.get(cell));
        }
        logger.info("Loaded {} cells ({} formulas, {} order)", cells.size(), formulas.size(), loadOrder);
    }

    /**
     * Cached value of a cell; EmptyValue when the cell is empty. Accepts "$A$1" style ids.
     */
    public Value getCellValue(String cellId) {
        return getCellValue(CellId.parse(cellId));
    }

    public Value getCellValue(CellId cell) {
        CellRecord record = cells.get(cell);
        return record == null ? Value.empty() : record.getValue();
    }

    /**
     * Values of the rectangle between two corners, row-major.
     */
    public List<Value> getRangeValues(String start, String end) {
        return getRangeValues(CellId.parse(start), CellId.parse(end));
    }

    public List<Value> getRangeValues(CellId start, CellId end) {
        List<Value> values = new ArrayList<>();
        for (CellId cell : new CellRange(start, end).cells()) {
            values.add(getCellValue(cell));
        }
        return values;
    }

    /**
     * What a formula bar shows: the formula text, else the raw value as text, else "".
     */
    public String getFormulaString(String cellId) {
        CellRecord record = cells.get(CellId.parse(cellId));
        if (record == null) {
            return "";
        }
        return record.isFormula() ? record.getFormula() : coercion.toText(record.getValue());
    }

    public Optional<CellRecord> getCellRecord(String cellId) {
        return Optional.ofNullable(cells.get(CellId.parse(cellId)));
    }

    public List<String> getFunctionNames() {
        return functionRegistry.list();
    }

    /** Cells that the given cell's formula reads. */
    public Set<CellId> getDependencies(String cellId) {
        return dependencyGraph.getDependencies(CellId.parse(cellId));
    }

    /** Cells whose formulas read the given cell. */
    public Set<CellId> getDependents(String cellId) {
        return dependencyGraph.getDependents(CellId.parse(cellId));
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private UpdateSet reject(CellId cell, String text, FormulaError error) {
        cells.put(cell, new CellRecord(text, error, null, null));
        dependencyGraph.clear(cell);
        return UpdateSet.of(cell, error);
    }

    /**
     * Re-evaluates every formula downstream of a changed cell, precedents first.
     */
    private UpdateSet recalculateDependents(CellId cell) {
        UpdateSet updates = new UpdateSet();
        for (CellId dependent : dependencyGraph.getRecalculationOrder(cell)) {
            CellRecord record = cells.get(dependent);
            if (record != null && record.getAst() != null) {
                Value value = evaluator.evaluate(record.getAst());
                record.setValue(value);
                updates.put(dependent, value);
            }
        }
        return updates;
    }

    private static List<CellId> byLength(Map<CellId, String> formulas, List<CellId> cellIds) {
        cellIds.sort(Comparator.comparingInt(cell -> formulas.get(cell).length()));
        return cellIds;
    }

    /**
     * Kahn's algorithm over the formula cells. Cells that never become ready
     * (cycles, unparseable formulas reading each other) follow, shortest first.
     */
    private List<CellId> topologicalOrder(Map<CellId, String> formulas) {
        Map<CellId, Set<CellId>> precedents = new HashMap<>();
        Map<CellId, List<CellId>> followers = new HashMap<>();
        for (Map.Entry<CellId, String> entry : formulas.entrySet()) {
            Set<CellId> reads = new HashSet<>();
            String formula = entry.getValue();
            try {
                AstNode ast = formula.startsWith("=") ? Parser.parseFormula(formula.substring(1)) : null;
                Set<CellId> dependencies = ast == null ? Collections.<CellId>emptySet() : DependencyExtractor.extract(ast);
                for (CellId dependency : dependencies) {
                    if (formulas.containsKey(dependency) && !dependency.equals(entry.getKey())) {
                        reads.add(dependency);
                    }
                }
            } catch (FormulaParseException e) {
                logger.debug("Formula in {} does not parse; ordering it without dependencies", entry.getKey());
            }
            precedents.put(entry.getKey(), reads);
            for (CellId dependency : reads) {
                followers.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        Deque<CellId> ready = new ArrayDeque<>();
        for (CellId cell : byLength(formulas, new ArrayList<>(formulas.keySet()))) {
            if (precedents.get(cell).isEmpty()) {
                ready.add(cell);
            }
        }
        List<CellId> order = new ArrayList<>();
        Set<CellId> placed = new HashSet<>();
        while (!ready.isEmpty()) {
            CellId cell = ready.poll();
            order.add(cell);
            placed.add(cell);
            for (CellId follower : followers.getOrDefault(cell, Collections.emptyList())) {
                Set<CellId> waiting = precedents.get(follower);
                waiting.remove(cell);
                if (waiting.isEmpty()) {
                    ready.add(follower);
                }
            }
        }

        List<CellId> leftovers = new ArrayList<>();
        for (CellId cell : formulas.keySet()) {
            if (!placed.contains(cell)) {
                leftovers.add(cell);
            }
        }
        order.addAll(byLength(formulas, leftovers));
        return order;
    }
}
