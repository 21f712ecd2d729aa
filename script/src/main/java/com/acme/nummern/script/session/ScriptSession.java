package com.acme.nummern.script.session;

import com.acme.nummern.script.command.Command;
import com.acme.nummern.script.command.SetCellsCommand;
import com.acme.nummern.script.command.TransactionKind;
import com.acme.nummern.script.command.TransactionManager;
import com.acme.nummern.script.compose.ScriptComposer;
import com.acme.nummern.script.history.CommandHistory;
import com.acme.nummern.script.history.HistoryCodec;
import com.acme.nummern.script.model.CellValue;
import com.acme.nummern.script.model.ProjectModel;
import com.acme.nummern.script.normalize.LogNormalizer;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One open document: the command history, the current project snapshot and
 * the script text. All mutations go through this object, one at a time.
 */
public final class ScriptSession {
    private static final Logger LOG = Logger.getLogger(ScriptSession.class.getName());

    private final TransactionManager transactions = new TransactionManager();
    private ProjectModel project = ProjectModel.empty();
    private String scriptText;

    private ScriptSession(String scriptText) {
        this.scriptText = scriptText;
    }

    public static ScriptSession create() {
        return new ScriptSession(ScriptComposer.defaultScript());
    }

    /**
     * Opens a document. History comes from {@code historyJson} when it decodes,
     * otherwise from the script's generated region.
     */
    public static ScriptSession open(String script, String historyJson) {
        String text = script == null || script.isEmpty() ? ScriptComposer.defaultScript() : script;
        ScriptSession session = new ScriptSession(text);
        CommandHistory history = null;
        if (historyJson != null && !historyJson.isBlank()) {
            try {
                history = HistoryCodec.decode(historyJson);
                LOG.info("Seeded history from artifact: " + history.commands().size() + " line(s)");
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "History artifact unreadable, rebuilding from script", e);
            }
        }
        if (history == null) {
            history = CommandHistory.fromScript(ScriptComposer.extractGeneratedRegion(text));
            LOG.info("Seeded history from generated region of script: " + history.commands().size() + " line(s)");
        }
        session.transactions.seed(history.commands());
        return session;
    }

    public ProjectModel project() {
        return project;
    }

    /** Applies and records {@code command} as its own transaction; returns its inverse if it has one. */
    public Optional<Command> perform(Command command) {
        Objects.requireNonNull(command, "command");
        ProjectModel before = project;
        Optional<Command> inverse = command.invert(before);
        transactions.begin(TransactionKind.GENERAL);
        project = command.apply(before);
        transactions.record(command);
        transactions.commit();
        return inverse;
    }

    public void beginCellEdit() {
        transactions.begin(TransactionKind.CELL_EDIT);
    }

    /** Writes cells inside the current cell-edit transaction, opening one if needed. */
    public void editCells(String tableId, Map<String, CellValue> cells) {
        if (!transactions.inTransaction()) {
            beginCellEdit();
        }
        SetCellsCommand command = new SetCellsCommand(tableId, cells);
        project = command.apply(project);
        transactions.record(command);
    }

    public void endCellEdit() {
        transactions.commit();
    }

    public String generatedScript() {
        return String.join("\n", LogNormalizer.normalize(transactions.allCommands()));
    }

    /** Full script: the preserved user region plus the freshly generated log. */
    public String script() {
        scriptText = ScriptComposer.compose(scriptText, generatedScript());
        return scriptText;
    }

    /** Replaces the script text after a hand edit. History is untouched until the next run. */
    public void replaceScript(String text) {
        scriptText = text == null ? "" : text;
    }

    public CommandHistory history() {
        return new CommandHistory(transactions.allCommands());
    }

    public String historyJson() {
        return HistoryCodec.encode(history());
    }

    /**
     * Adopts the result of a successful run: history is re-seeded from the
     * executed script so later edits append to what ran.
     */
    public void adoptRun(String executedScript, ProjectModel snapshot) {
        Objects.requireNonNull(executedScript, "executedScript");
        Objects.requireNonNull(snapshot, "snapshot");
        transactions.reset();
        transactions.seed(CommandHistory.fromScript(ScriptComposer.extractGeneratedRegion(executedScript)).commands());
        project = snapshot;
        scriptText = executedScript;
    }
}
