package com.acme.nummern.script.command;

import com.acme.nummern.script.formula.FormulaTranslator;
import com.acme.nummern.script.model.CellAddress;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.FormulaSpec;
import com.acme.nummern.script.model.ModelIds;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.model.RangeAddress;
import com.acme.nummern.script.model.TableModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sets or clears the formula at {@code target}. A blank formula removes the
 * entry and clears the stored values under the target.
 */
public record SetFormulaCommand(String commandId, Instant timestamp, String tableId, String target, String formula)
    implements Command {

    public SetFormulaCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(formula, "formula");
        target = ScriptCalls.address(Objects.requireNonNull(target, "target")).toWire();
    }

    public SetFormulaCommand(String tableId, String target, String formula) {
        this(ModelIds.make(), Instant.now(), tableId, target, formula);
    }

    public boolean clears() {
        return FormulaTranslator.body(formula).isEmpty();
    }

    @Override
    public ProjectModel apply(ProjectModel project) {
        return project.updateTable(tableId, t -> {
            Map<String, FormulaSpec> formulas = new HashMap<>(t.formulas());
            if (!clears()) {
                formulas.put(target, new FormulaSpec(formula.trim()));
                return t.withFormulas(formulas);
            }
            formulas.remove(target);
            Map<String, CellValue> values = new HashMap<>(t.cellValues());
            RangeAddress range = ScriptCalls.address(target);
            for (CellAddress cell : range.cells()) {
                values.remove(RangeAddress.single(range.region(), cell.row(), cell.col()).toWire());
            }
            return t.withFormulas(formulas).withCellValues(values);
        });
    }

    @Override
    public String toScript() {
        return ScriptCalls.lines(FormulaTranslator.renderSetFormula(tableId, ScriptCalls.address(target), formula));
    }

    @Override
    public Optional<Command> invert(ProjectModel previous) {
        Optional<TableModel> before = previous.table(tableId);
        if (before.isEmpty()) {
            return Optional.empty();
        }
        TableModel table = before.get();
        FormulaSpec prior = table.formulas().get(target);
        Map<String, CellValue> priorValues = CellWrites.priorValues(table, ScriptCalls.address(target));
        List<Command> steps = new ArrayList<>(2);
        if (prior != null) {
            if (!priorValues.isEmpty()) {
                steps.add(new SetCellsCommand(tableId, priorValues));
            }
            steps.add(new SetFormulaCommand(tableId, target, prior.formula()));
        } else {
            steps.add(new SetFormulaCommand(tableId, target, ""));
            if (!priorValues.isEmpty()) {
                steps.add(new SetCellsCommand(tableId, priorValues));
            }
        }
        return Optional.of(steps.size() == 1 ? steps.get(0) : new CommandBatch(steps));
    }
}
