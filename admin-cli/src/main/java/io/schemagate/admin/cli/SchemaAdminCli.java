package io.schemagate.admin.cli;

import io.schemagate.core.approval.ChangeApprovalGate;
import io.schemagate.core.engine.SchemaEvolutionEngine;
import io.schemagate.core.error.SchemagateException;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeRequest;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.ReviewAction;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reviewer commands over a change approval gate.
 *
 * <pre>
 * list [--reviewer name]
 * review requestId approve|reject reviewer [comments]
 * history [--limit n]
 * request add field type [--description d] [--required] [--justification j] [--proposed-by p]
 * request remove field [--justification j] [--proposed-by p]
 * schema
 * </pre>
 *
 * <p>
 * {@link #run(List)} never throws for bad input; it prints a message and
 * returns an exit code.
 */
public final class SchemaAdminCli {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaAdminCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_REFUSED = 2;

    static final String DEFAULT_REVIEWER = "admin";
    static final int DEFAULT_HISTORY_LIMIT = 10;
    static final String DEFAULT_PROPOSER = "admin-cli";

    private static final Set<String> FLAGS = Set.of("--required");

    private final ChangeApprovalGate gate;
    private final SchemaEvolutionEngine engine;
    private final PrintStream out;

    public SchemaAdminCli(ChangeApprovalGate gate, SchemaEvolutionEngine engine, PrintStream out) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Runs one command.
     *
     * @param args command and its arguments, without {@code --config}
     * @return {@link #EXIT_OK}, {@link #EXIT_ERROR} or {@link #EXIT_REFUSED}
     */
    public int run(List<String> args) {
        if (args.isEmpty()) {
            printUsage();
            return EXIT_ERROR;
        }
        try {
            ParsedArgs parsed = ParsedArgs.parse(args.subList(1, args.size()));
            switch (args.get(0)) {
                case "list":
                    return list(parsed);
                case "review":
                    return review(parsed);
                case "history":
                    return history(parsed);
                case "request":
                    return request(parsed);
                case "schema":
                    return schema();
                case "help":
                    printUsage();
                    return EXIT_OK;
                default:
                    out.println("Unknown command: " + args.get(0));
                    printUsage();
                    return EXIT_ERROR;
            }
        } catch (UsageException e) {
            out.println(e.getMessage());
            printUsage();
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (SchemagateException e) {
            LOG.error("Command failed: {}", e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int list(ParsedArgs args) {
        String reviewer = args.option("--reviewer").orElse(DEFAULT_REVIEWER);
        List<ChangeRequest> pending = gate.getPendingRequests(reviewer);
        if (pending.isEmpty()) {
            out.println("No pending requests for " + reviewer);
            return EXIT_OK;
        }
        out.println(pending.size() + " pending request(s) for " + reviewer + ":");
        for (ChangeRequest r : pending) {
            out.printf(
                    "  %s  %s %s  risk=%s approval=%s  by %s%n",
                    r.id(),
                    r.changeType().wireName(),
                    r.fieldName(),
                    r.riskLevel().wireName(),
                    r.requiredApprovalLevel().wireName(),
                    r.proposedBy());
            if (!r.justification().isEmpty()) {
                out.println("      " + r.justification());
            }
        }
        return EXIT_OK;
    }

    private int review(ParsedArgs args) {
        List<String> pos = args.positional();
        if (pos.size() < 3) {
            throw new UsageException("review needs <requestId> <approve|reject> <reviewer> [comments]");
        }
        String requestId = pos.get(0);
        ReviewAction action = ReviewAction.parse(pos.get(1))
                .orElseThrow(() -> new UsageException("Unknown review action '" + pos.get(1) + "'"));
        String reviewer = pos.get(2);
        String comments = pos.size() > 3 ? String.join(" ", pos.subList(3, pos.size())) : "";

        if (!gate.reviewRequest(requestId, reviewer, action, comments)) {
            out.println("Review refused: request " + requestId + " is not pending or " + reviewer
                    + " may not review it");
            return EXIT_REFUSED;
        }
        ChangeRequest decided = gate.findRequest(requestId).orElseThrow();
        out.println("Request " + requestId + " is now " + decided.status().wireName());
        if (!decided.reviewComments().isEmpty()) {
            out.println("  " + decided.reviewComments());
        }
        return EXIT_OK;
    }

    private int history(ParsedArgs args) {
        int limit = args.option("--limit").map(SchemaAdminCli::parseLimit).orElse(DEFAULT_HISTORY_LIMIT);
        List<ChangeRequest> history = gate.getApprovalHistory(limit);
        if (history.isEmpty()) {
            out.println("No decided requests");
            return EXIT_OK;
        }
        for (ChangeRequest r : history) {
            out.printf(
                    "%s  %-8s %s %s  by %s, reviewed by %s at %s%n",
                    r.id(),
                    r.status().wireName(),
                    r.changeType().wireName(),
                    r.fieldName(),
                    r.proposedBy(),
                    r.reviewedBy(),
                    r.reviewedAt());
            if (!r.reviewComments().isEmpty()) {
                out.println("    " + r.reviewComments());
            }
        }
        return EXIT_OK;
    }

    private int request(ParsedArgs args) {
        List<String> pos = args.positional();
        if (pos.isEmpty()) {
            throw new UsageException("request needs 'add' or 'remove'");
        }
        String proposer = args.option("--proposed-by").orElse(DEFAULT_PROPOSER);
        String justification = args.option("--justification").orElse("");
        String id;
        switch (pos.get(0)) {
            case "add":
                if (pos.size() < 3) {
                    throw new UsageException("request add needs <field> <type>");
                }
                ChangeDetails details = ChangeDetails.forNewField(
                        FieldType.fromWire(pos.get(2)),
                        args.option("--description").orElse(""),
                        args.flag("--required"));
                id = gate.createChangeRequest(ChangeType.ADD_FIELD, pos.get(1), details, proposer, justification);
                break;
            case "remove":
                if (pos.size() < 2) {
                    throw new UsageException("request remove needs <field>");
                }
                id = gate.createChangeRequest(
                        ChangeType.REMOVE_FIELD, pos.get(1), ChangeDetails.empty(), proposer, justification);
                break;
            default:
                throw new UsageException("Unknown request kind '" + pos.get(0) + "'");
        }
        ChangeRequest created = gate.findRequest(id).orElseThrow();
        out.println("Created request " + id + ": " + created.status().wireName() + " (risk "
                + created.riskLevel().wireName() + ", approval " + created.requiredApprovalLevel().wireName() + ")");
        if (!created.reviewComments().isEmpty()) {
            out.println("  " + created.reviewComments());
        }
        return EXIT_OK;
    }

    private int schema() {
        SchemaVersion current = engine.currentSchema();
        out.println("Schema " + current.version() + " - " + current.description());
        out.println("  " + current.fields().size() + " field(s), backward compatible: "
                + current.backwardCompatible());
        for (SchemaField f : current.fields().values()) {
            out.printf(
                    "  %-20s %-9s%s%s%s%n",
                    f.name(),
                    f.type().wireName(),
                    f.required() ? " required" : "",
                    f.core() ? " core" : "",
                    f.deprecated() ? " deprecated" : "");
        }
        return EXIT_OK;
    }

    private static int parseLimit(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new UsageException("--limit must be an integer, got '" + raw + "'");
        }
    }

    private void printUsage() {
        out.println("Usage: schemagate-admin [--config <path>] <command>");
        out.println("  list [--reviewer <name>]");
        out.println("  review <requestId> <approve|reject> <reviewer> [comments]");
        out.println("  history [--limit <n>]");
        out.println("  request add <field> <type> [--description d] [--required] [--justification j]"
                + " [--proposed-by p]");
        out.println("  request remove <field> [--justification j] [--proposed-by p]");
        out.println("  schema");
    }

    /** Splits arguments into positionals, {@code --name value} options and bare flags. */
    record ParsedArgs(List<String> positional, Map<String, String> options) {

        static ParsedArgs parse(List<String> args) {
            List<String> positional = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            for (int i = 0; i < args.size(); i++) {
                String arg = args.get(i);
                if (FLAGS.contains(arg)) {
                    options.put(arg, "true");
                } else if (arg.startsWith("--")) {
                    if (i + 1 >= args.size()) {
                        throw new UsageException(arg + " requires a value");
                    }
                    options.put(arg, args.get(++i));
                } else {
                    positional.add(arg);
                }
            }
            return new ParsedArgs(List.copyOf(positional), Map.copyOf(options));
        }

        Optional<String> option(String name) {
            return Optional.ofNullable(options.get(name));
        }

        boolean flag(String name) {
            return options.containsKey(name);
        }
    }

    /** Bad command line. */
    static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
