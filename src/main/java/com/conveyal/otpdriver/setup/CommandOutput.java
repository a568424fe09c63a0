package com.conveyal.otpdriver.setup;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/** The merged output lines and exit code of a command that has run to completion. */
public class CommandOutput {

    public final List<String> lines;

    public final int exitCode;

    public CommandOutput (List<String> lines, int exitCode) {
        this.lines = ImmutableList.copyOf(lines);
        this.exitCode = exitCode;
    }

    public boolean anyLineContainsIgnoreCase (String marker) {
        return lines.stream().anyMatch(line -> StringUtils.containsIgnoreCase(line, marker));
    }

    public String firstLine () {
        return lines.isEmpty() ? null : lines.get(0);
    }

    @Override
    public String toString () {
        return String.join("\n", lines);
    }

}
