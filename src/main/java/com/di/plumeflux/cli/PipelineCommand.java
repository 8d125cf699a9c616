package com.di.plumeflux.cli;

import com.di.plumeflux.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Subcommands accepted on the command line. */
public enum PipelineCommand {
    DOAS("doas"),
    PYPLIS("pyplis"),
    WATCHER("watcher");

    private final String commandName;

    PipelineCommand(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    public boolean isLongRunning() {
        return this == WATCHER;
    }

    public static PipelineCommand parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("No command given; expected one of " + names());
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PipelineCommand command : values()) {
            if (command.commandName.equals(normalized)) {
                return command;
            }
        }
        throw new ConfigurationException("Unknown command '" + value + "'; expected one of " + names());
    }

    private static String names() {
        return Arrays.stream(values()).map(PipelineCommand::getCommandName).collect(Collectors.joining(", "));
    }
}
