package com.acme.nummern.script.command;

import com.acme.nummern.script.model.ProjectModel;

import java.time.Instant;
import java.util.Optional;

/**
 * One editor mutation. Commands are immutable and side-effect free until
 * applied; {@link #apply} is deterministic for a given prior snapshot.
 */
public sealed interface Command
    permits AddSheetCommand, RenameSheetCommand, AddTableCommand, MoveTableCommand, ResizeTableCommand,
            MinimizeTableCommand, SetLabelBandsCommand, SetCellsCommand, SetRangeCommand, SetFormulaCommand,
            InsertRowsCommand, InsertColsCommand, SetColumnTypeCommand, CreateSummaryTableCommand, CommandBatch {

    String commandId();

    Instant timestamp();

    /** Returns the snapshot after this command. The argument is never modified. */
    ProjectModel apply(ProjectModel project);

    /** Script lines joined by {@code \n}; empty when the command does nothing. */
    String toScript();

    /**
     * Command that undoes this one when applied to the result of
     * {@code apply(previous)}.
     */
    default Optional<Command> invert(ProjectModel previous) {
        return Optional.empty();
    }

    default boolean isNoOp() {
        return toScript().isEmpty();
    }
}
