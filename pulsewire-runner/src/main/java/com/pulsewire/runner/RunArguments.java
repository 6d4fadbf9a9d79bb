package com.pulsewire.runner;

import com.pulsewire.core.config.Depth;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Command-line flags. Values may be given as {@code --flag=value} or {@code --flag value}.
 */
public record RunArguments(
    Path config,            // null means the default location
    String collectors,
    String excludeCollectors,
    boolean noCache,
    Integer limit,
    int retries,
    Duration timeout,       // null keeps the depth timeout
    Depth depth,
    boolean trace,
    int days,
    String reportType,
    Path output,
    boolean dryRun,
    boolean help
) {
    public static final int DEFAULT_DAYS = 30;

    public static final String USAGE = String.join("\n",
        "Usage: pulsewire [options]",
        "  --config=PATH                 configuration file (default ~/.config/pulsewire/pulsewire.yaml)",
        "  --collectors=a,b              run only these collectors",
        "  --exclude-collectors=a,b      skip these collectors",
        "  --quick | --deep              research depth (default: default)",
        "  --days=N                      window length in days (default 30)",
        "  --limit=N                     keep the N best items",
        "  --retry=N                     extra attempts per failed collector",
        "  --timeout=S                   per-collector timeout in seconds",
        "  --no-cache                    ignore cached responses",
        "  --report=TYPE                 report type (default daily_brief)",
        "  --output=PATH                 write the JSON result to PATH",
        "  --trace                       print the run trace and its JSON (written next to --output if given)",
        "  --dry-run                     show collector availability and exit",
        "  --help                        show this help");

    /**
     * @throws IllegalArgumentException for unknown flags, malformed numbers or conflicting depths
     */
    public static RunArguments parse(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String flag = args[i].contains("=") ? args[i].substring(0, args[i].indexOf('=')) : args[i];
            if (!KNOWN_FLAGS.contains(flag)) {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
            if (VALUE_FLAGS.contains(flag) && !args[i].contains("=")) {
                i++;
            }
        }

        boolean quick = hasArg(args, "--quick");
        boolean deep = hasArg(args, "--deep");
        if (quick && deep) {
            throw new IllegalArgumentException("--quick and --deep are mutually exclusive");
        }

        Integer limit = hasValue(args, "--limit") ? positive("--limit", getIntArg(args, "--limit", 0)) : null;
        Integer timeoutSeconds = hasValue(args, "--timeout") ? positive("--timeout", getIntArg(args, "--timeout", 0)) : null;
        int retries = getIntArg(args, "--retry", 0);
        if (retries < 0) {
            throw new IllegalArgumentException("--retry must not be negative: " + retries);
        }
        String config = getArg(args, "--config");
        String output = getArg(args, "--output");

        return new RunArguments(
            config != null ? Path.of(config) : null,
            getArg(args, "--collectors"),
            getArg(args, "--exclude-collectors"),
            hasArg(args, "--no-cache"),
            limit,
            retries,
            timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null,
            quick ? Depth.QUICK : deep ? Depth.DEEP : Depth.DEFAULT,
            hasArg(args, "--trace"),
            positive("--days", getIntArg(args, "--days", DEFAULT_DAYS)),
            getArg(args, "--report"),
            output != null ? Path.of(output) : null,
            hasArg(args, "--dry-run"),
            hasArg(args, "--help") || hasArg(args, "-h"));
    }

    // ==================== Flag helpers ====================

    private static final Set<String> VALUE_FLAGS = Set.of(
        "--config", "--collectors", "--exclude-collectors", "--limit", "--retry", "--timeout",
        "--days", "--report", "--output");
    private static final Set<String> SWITCHES = Set.of(
        "--no-cache", "--quick", "--deep", "--trace", "--dry-run", "--help", "-h");
    private static final Set<String> KNOWN_FLAGS = union(VALUE_FLAGS, SWITCHES);

    private static boolean hasArg(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) return true;
        }
        return false;
    }

    private static boolean hasValue(String[] args, String flag) {
        return getArg(args, flag) != null;
    }

    private static String getArg(String[] args, String flag) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith(flag + "=")) {
                return args[i].substring(flag.length() + 1);
            }
            if (args[i].equals(flag)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(flag + " needs a value");
                }
                return args[i + 1];
            }
        }
        return null;
    }

    private static int getIntArg(String[] args, String flag, int defaultValue) {
        String value = getArg(args, flag);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number: " + value, e);
        }
    }

    private static int positive(String flag, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(flag + " must be positive: " + value);
        }
        return value;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
