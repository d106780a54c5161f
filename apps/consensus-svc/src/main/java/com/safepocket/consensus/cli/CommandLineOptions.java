package com.safepocket.consensus.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.ApplicationArguments;

/**
 * Parsed {@code --csv}, {@code --db}, {@code --table}, {@code --output} and {@code --compare} options.
 */
public record CommandLineOptions(
        Optional<Path> csv,
        Optional<String> db,
        String table,
        Optional<Path> output,
        boolean compare
) {

    public static final String DEFAULT_TABLE = "transactions";

    public static final String USAGE = String.join("\n",
            "Usage: consensus-svc (--csv=<path> | --db=<path|jdbc-url> [--table=<name>]) [--output=<report.json>] [--compare]",
            "  --csv      CSV file with a header row",
            "  --db       SQLite file or JDBC URL",
            "  --table    table to read with --db (default: " + DEFAULT_TABLE + ")",
            "  --output   write the JSON report to this path",
            "  --compare  print per-category comparison and overlap matrix");

    public CommandLineOptions {
        if (csv.isPresent() == db.isPresent()) {
            throw new IllegalArgumentException("exactly one of --csv or --db is required");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("--table must not be blank");
        }
    }

    /**
     * True when the arguments ask for a command-line run rather than the HTTP service.
     */
    public static boolean requested(String... args) {
        for (String arg : args) {
            if (arg.equals("--csv") || arg.startsWith("--csv=") || arg.equals("--db") || arg.startsWith("--db=")) {
                return true;
            }
        }
        return false;
    }

    public static boolean requested(ApplicationArguments args) {
        return args.containsOption("csv") || args.containsOption("db");
    }

    public static CommandLineOptions parse(ApplicationArguments args) {
        return new CommandLineOptions(
                single(args, "csv").map(Path::of),
                single(args, "db"),
                single(args, "table").orElse(DEFAULT_TABLE),
                single(args, "output").map(Path::of),
                args.containsOption("compare")
        );
    }

    private static Optional<String> single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return Optional.empty();
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires exactly one value");
        }
        return Optional.of(values.get(0));
    }
}
