package com.di.plumeflux.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Accepts the {@code --option value} form the station scripts use and rewrites it to the
 * {@code --option=value} form Spring's argument parser expects.
 */
public final class CommandLineArgs {

    public static final String CONFIG_PATH = "config_path";
    public static final String DOAS_RESULTS = "doas_results";
    public static final String OUTPUT_DIRECTORY = "output_directory";
    public static final String RERUN = "rerun";
    public static final String FORCE = "force";

    private static final Set<String> VALUE_OPTIONS = Set.of(CONFIG_PATH, DOAS_RESULTS, OUTPUT_DIRECTORY, RERUN);

    private CommandLineArgs() {
    }

    public static String[] normalize(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--") && !arg.contains("=") && VALUE_OPTIONS.contains(arg.substring(2))
                    && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                out.add(arg + "=" + args[++i]);
            } else {
                out.add(arg);
            }
        }
        return out.toArray(new String[0]);
    }
}
