package com.bookkeeper.ingest.cli;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.service.ImportOptions;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command line. Options accept both {@code --name value} and {@code --name=value}; anything
 * not given on the command line falls back to {@code bookkeeping.ingest.*}.
 */
public record IngestCommandLine(
        Mode mode,
        ImportOptions importOptions,
        int batchSize,
        int limit,
        ReviewRequest review,
        RuleRequest rule
) {
    public enum Mode {
        IMPORT,
        CATEGORIZE,
        REVIEW_QUEUE,
        REVIEW,
        ADD_RULE,
        HELP
    }

    public record ReviewRequest(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes) {}

    public record RuleRequest(String pattern, String category, boolean regex, int priority) {}

    static final int DEFAULT_LIMIT = 1000;

    public static final String USAGE = String.join("\n",
            "usage: ingest-svc [options]",
            "  --input <dir>                 directory of CSV exports to import",
            "  --since <yyyy-MM-dd>          skip rows dated before this day",
            "  --recursive                   descend into sub-directories",
            "  --dry-run                     run the full pipeline without writing anything",
            "  --source-from <filename|col>  where the source label comes from",
            "  --assume-encoding <charset>   force the file encoding",
            "  --categorize [--batch N] [--limit N]",
            "                                categorize stored transactions without a category",
            "  --review-queue                list duplicate groups waiting for review",
            "  --review <DUP_nnnn>:<keep|merge|delete|ignore>[:<keepId>] [--reviewer name] [--notes text]",
            "  --add-rule <pattern>=<category>[;priority=N][;regex]",
            "  --help");

    private static final Set<String> FLAGS = Set.of("recursive", "dry-run", "categorize", "review-queue", "help");
    private static final Set<String> VALUED = Set.of("input", "since", "source-from", "assume-encoding", "batch",
            "limit", "review", "reviewer", "notes", "add-rule");

    /**
     * @throws IllegalArgumentException for unknown options, missing values or conflicting modes
     */
    public static IngestCommandLine parse(String[] args, BookkeepingProperties properties) {
        Map<String, String> values = new HashMap<>();
        List<String> flags = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
            }
            String name = arg.substring(2);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (FLAGS.contains(name)) {
                if (inlineValue != null) {
                    throw new IllegalArgumentException("--" + name + " does not take a value");
                }
                flags.add(name);
            } else if (VALUED.contains(name)) {
                String value = inlineValue;
                if (value == null) {
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        throw new IllegalArgumentException("--" + name + " requires a value");
                    }
                    value = args[++i];
                }
                if (values.put(name, value) != null) {
                    throw new IllegalArgumentException("--" + name + " given more than once");
                }
            } else {
                throw new IllegalArgumentException("Unknown option --" + name);
            }
        }

        if (flags.contains("help")) {
            return new IngestCommandLine(Mode.HELP, null, 0, 0, null, null);
        }
        Mode mode = resolveMode(flags, values);
        boolean dryRun = flags.contains("dry-run");
        if (dryRun && mode != Mode.IMPORT) {
            throw new IllegalArgumentException("--dry-run only applies to imports");
        }

        BookkeepingProperties.Ingest ingest = properties.ingest();
        return switch (mode) {
            case IMPORT -> {
                String input = values.getOrDefault("input", ingest.hasInputDir() ? ingest.inputDir() : null);
                if (input == null || input.isBlank()) {
                    throw new IllegalArgumentException("--input is required");
                }
                ImportOptions options = new ImportOptions(
                        Path.of(input),
                        parseDate(values.get("since")),
                        flags.contains("recursive") || ingest.recursiveFlag(),
                        dryRun,
                        values.getOrDefault("source-from", ingest.sourceFrom()),
                        parseCharset(values.getOrDefault("assume-encoding", ingest.assumeEncoding()))
                );
                yield new IngestCommandLine(mode, options, 0, 0, null, null);
            }
            case CATEGORIZE -> new IngestCommandLine(mode, null,
                    parsePositive("batch", values.get("batch"), properties.ai().batchSizeOrDefault()),
                    parsePositive("limit", values.get("limit"), DEFAULT_LIMIT),
                    null, null);
            case REVIEW -> new IngestCommandLine(mode, null, 0, 0,
                    parseReview(values.get("review"), values.getOrDefault("reviewer", "cli"), values.get("notes")), null);
            case ADD_RULE -> new IngestCommandLine(mode, null, 0, 0, null, parseRule(values.get("add-rule")));
            default -> new IngestCommandLine(mode, null, 0, 0, null, null);
        };
    }

    private static Mode resolveMode(List<String> flags, Map<String, String> values) {
        List<Mode> modes = new ArrayList<>();
        if (flags.contains("categorize")) {
            modes.add(Mode.CATEGORIZE);
        }
        if (flags.contains("review-queue")) {
            modes.add(Mode.REVIEW_QUEUE);
        }
        if (values.containsKey("review")) {
            modes.add(Mode.REVIEW);
        }
        if (values.containsKey("add-rule")) {
            modes.add(Mode.ADD_RULE);
        }
        if (modes.size() > 1) {
            throw new IllegalArgumentException("Choose one of --categorize, --review-queue, --review, --add-rule");
        }
        if (!modes.isEmpty() && values.containsKey("input")) {
            throw new IllegalArgumentException("--input cannot be combined with --" + modes.get(0).name().toLowerCase(Locale.ROOT).replace('_', '-'));
        }
        return modes.isEmpty() ? Mode.IMPORT : modes.get(0);
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("--since must be yyyy-MM-dd, got '" + value + "'", ex);
        }
    }

    static Charset parseCharset(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Charset.forName(value.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            throw new IllegalArgumentException("Unknown encoding '" + value + "'", ex);
        }
    }

    private static int parsePositive(String name, String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException("--" + name + " must be positive");
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " must be a number, got '" + value + "'", ex);
        }
    }

    /**
     * {@code DUP_0001:delete:42}; the keep id is required by merge and delete.
     */
    static ReviewRequest parseReview(String value, String reviewer, String notes) {
        String[] parts = value.split(":", -1);
        if (parts.length < 2 || parts.length > 3 || parts[0].isBlank()) {
            throw new IllegalArgumentException("--review expects <DUP_nnnn>:<action>[:<keepId>], got '" + value + "'");
        }
        ReviewAction action = ReviewAction.parse(parts[1]);
        Long keepId = null;
        if (parts.length == 3 && !parts[2].isBlank()) {
            try {
                keepId = Long.parseLong(parts[2].trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("keep id must be a number, got '" + parts[2] + "'", ex);
            }
        }
        if (action.removesMembers() && keepId == null) {
            throw new IllegalArgumentException(action.dbValue() + " requires the id of the transaction to keep");
        }
        return new ReviewRequest(parts[0].trim(), action, keepId, reviewer, notes);
    }

    /**
     * {@code STARBUCKS=Dining;priority=5;regex}.
     */
    static RuleRequest parseRule(String value) {
        String[] segments = value.split(";");
        int eq = segments[0].lastIndexOf('=');
        if (eq <= 0 || eq == segments[0].length() - 1) {
            throw new IllegalArgumentException("--add-rule expects <pattern>=<category>, got '" + value + "'");
        }
        String pattern = segments[0].substring(0, eq).trim();
        String category = segments[0].substring(eq + 1).trim();
        boolean regex = false;
        int priority = 0;
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i].trim();
            if (segment.equalsIgnoreCase("regex")) {
                regex = true;
            } else if (segment.toLowerCase(Locale.ROOT).startsWith("priority=")) {
                try {
                    priority = Integer.parseInt(segment.substring("priority=".length()).trim());
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("priority must be a number, got '" + segment + "'", ex);
                }
            } else if (!segment.isEmpty()) {
                throw new IllegalArgumentException("Unknown rule option '" + segment + "'");
            }
        }
        return new RuleRequest(pattern, category, regex, priority);
    }
}
