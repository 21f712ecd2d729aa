package com.acme.nummern.script.command;

import com.acme.nummern.script.model.ModelIds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups recorded commands into transactions and serves the flattened script
 * log.
 *
 * <p>Inside a {@link TransactionKind#CELL_EDIT} transaction a cell write to the
 * same table as the previously recorded cell write replaces it with the merged
 * command, so a burst of keystrokes yields one block of assignments.</p>
 *
 * <p>Not thread-safe. The owning session serializes all mutations.</p>
 */
public final class TransactionManager {
    private static final Logger LOG = Logger.getLogger(TransactionManager.class.getName());

    private final List<String> seededLines = new ArrayList<>();
    private final List<CommandTransaction> committed = new ArrayList<>();
    private final List<Command> pending = new ArrayList<>();
    private TransactionKind pendingKind;
    private String pendingId;
    private Instant pendingStart;

    /** Opens a transaction, committing any one still open. */
    public void begin(TransactionKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (pendingKind != null) {
            commit();
        }
        pendingKind = kind;
        pendingId = ModelIds.make();
        pendingStart = Instant.now();
    }

    public boolean inTransaction() {
        return pendingKind != null;
    }

    /**
     * Adds {@code command} to the open transaction, opening a general one if
     * needed. No-op commands are dropped.
     */
    public void record(Command command) {
        Objects.requireNonNull(command, "command");
        if (command.isNoOp()) {
            LOG.fine(() -> "Skipping no-op " + command.getClass().getSimpleName());
            return;
        }
        if (pendingKind == null) {
            begin(TransactionKind.GENERAL);
        }
        if (pendingKind == TransactionKind.CELL_EDIT
            && command instanceof SetCellsCommand incoming
            && !pending.isEmpty()
            && pending.get(pending.size() - 1) instanceof SetCellsCommand last
            && last.tableId().equals(incoming.tableId())) {
            pending.set(pending.size() - 1, last.mergedWith(incoming));
            return;
        }
        pending.add(command);
    }

    /** Closes the open transaction. Empty transactions are discarded. */
    public Optional<CommandTransaction> commit() {
        if (pendingKind == null) {
            return Optional.empty();
        }
        CommandTransaction tx = new CommandTransaction(pendingId, pendingStart, pendingKind, pending);
        pending.clear();
        pendingKind = null;
        pendingId = null;
        pendingStart = null;
        if (tx.isEmpty()) {
            return Optional.empty();
        }
        committed.add(tx);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Committed " + tx.kind() + " transaction " + tx.id() + " with " + tx.commands().size() + " command(s)");
        }
        return Optional.of(tx);
    }

    /** Commands of the open transaction, in recording order. */
    public List<Command> pendingCommands() {
        return List.copyOf(pending);
    }

    public List<CommandTransaction> transactions() {
        return Collections.unmodifiableList(committed);
    }

    /** Installs baseline history lines served ahead of committed transactions. */
    public void seed(List<String> lines) {
        seededLines.clear();
        seededLines.addAll(lines);
    }

    public void reset() {
        seededLines.clear();
        committed.clear();
        pending.clear();
        pendingKind = null;
        pendingId = null;
        pendingStart = null;
    }

    /** Seeded lines followed by every committed command's rendered lines. */
    public List<String> allCommands() {
        List<String> out = new ArrayList<>(seededLines);
        for (CommandTransaction tx : committed) {
            for (Command command : tx.commands()) {
                String script = command.toScript();
                if (!script.isEmpty()) {
                    Collections.addAll(out, script.split("\n", -1));
                }
            }
        }
        return out;
    }

    public String scriptLog() {
        return String.join("\n", allCommands());
    }
}
