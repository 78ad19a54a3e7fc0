package com.chimera.dispatch.cli;

import com.chimera.core.model.OperationRecord;
import com.chimera.core.persistence.JournalException;
import com.chimera.core.persistence.OperationJournal;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: chimera history
 * <p>
 * Reads journaled operations straight from the journal, so it works without
 * a running server when a database is configured.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List journaled operations")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final OperationJournal journal;

    public HistoryCommand(OperationJournal journal) {
        this.journal = journal;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<OperationRecord> operations;
        try {
            operations = journal.operations().stream()
                    .sorted(Comparator.comparing(OperationRecord::createdAt).reversed())
                    .toList();
        } catch (JournalException e) {
            ConsoleOutput.error("Journal unavailable: " + e.getMessage());
            return 1;
        }
        if (operations.isEmpty()) {
            ConsoleOutput.info("No operations found.");
            return 0;
        }

        List<OperationRecord> display = operations.size() > limit ? operations.subList(0, limit) : operations;
        ConsoleOutput.info("Operations (" + display.size() + " of " + operations.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-10s %-16s %-22s %s%n", "OPERATION ID", "STATUS", "ADVERSARY", "STARTED", "NAME");
        System.out.println("  " + "-".repeat(100));
        for (OperationRecord op : display) {
            System.out.printf("  %-38s %-10s %-16s %-22s %s%n", op.id(), op.status(),
                    ConsoleOutput.truncate(op.adversaryId(), 16), op.createdAt(),
                    ConsoleOutput.truncate(op.name(), 30));
        }
        return 0;
    }
}
