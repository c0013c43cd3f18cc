package com.guardian.rag.cli;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@code <command> --name value ... --flag} style arguments. Options not
 * declared for the command are rejected.
 */
public final class CliArguments {

    private final String command;
    private final Map<String, String> options;
    private final Set<String> flags;

    private CliArguments(String command, Map<String, String> options, Set<String> flags) {
        this.command = command;
        this.options = options;
        this.flags = flags;
    }

    /**
     * @param valueOptions options that take a value, e.g. {@code --collection}
     * @param flagOptions  options that take no value, e.g. {@code --rerank}
     * @param aliases      short names mapped to their long form, e.g. {@code -q -> --query}
     */
    public static CliArguments parse(String[] args, Set<String> valueOptions, Set<String> flagOptions,
                                     Map<String, String> aliases) {
        if (args.length == 0) {
            throw new CliUsageException("Missing command");
        }
        Map<String, String> options = new HashMap<>();
        Set<String> flags = new HashSet<>();

        for (int i = 1; i < args.length; i++) {
            String arg = aliases.getOrDefault(args[i], args[i]);
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                value = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }

            if (flagOptions.contains(arg)) {
                flags.add(arg);
            } else if (valueOptions.contains(arg)) {
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new CliUsageException("Option " + arg + " needs a value");
                    }
                    value = args[++i];
                }
                options.put(arg, value);
            } else {
                throw new CliUsageException("Unknown argument for '" + args[0] + "': " + args[i]);
            }
        }
        return new CliArguments(args[0], options, flags);
    }

    public String command() {
        return command;
    }

    public String require(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new CliUsageException("Missing required option " + name);
        }
        return value;
    }

    public String get(String name) {
        return options.get(name);
    }

    public int getInt(String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CliUsageException("Option " + name + " must be an integer, got '" + value + "'");
        }
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }
}
