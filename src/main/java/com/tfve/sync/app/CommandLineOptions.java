package com.tfve.sync.app;

import com.tfve.sync.input.InputException;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Options of one invocation.
 *
 * <pre>
 * tfvar-export [--target-workspaces=NAME1,NAME2] [--allow-update] [--info-log]
 *              [--show-outputs] [--show-workspaces]
 *              PATH_TO_OUTPUT_VALUES_FILE PATH_TO_EXPORT_LIST
 * </pre>
 *
 * {@code --base-url} and {@code --failure-policy} are plain properties resolved through
 * {@code application.yml}; they are not read here.
 *
 * @param outputValuesFile output of {@code terraform output -json}, null only with {@code --show-workspaces}
 * @param exportList export list file, null unless exporting
 * @param targetWorkspaces workspace names in command line order, without duplicates
 */
public record CommandLineOptions(
        Path outputValuesFile,
        Path exportList,
        List<String> targetWorkspaces,
        boolean allowUpdate,
        boolean infoLog,
        boolean showOutputs,
        boolean showWorkspaces
) {

    static final String USAGE = "usage: tfvar-export [--target-workspaces=NAME1,NAME2] [--allow-update] [--info-log] "
            + "[--show-outputs] [--show-workspaces] [--base-url=URL] [--failure-policy=STOP|CONTINUE] "
            + "PATH_TO_OUTPUT_VALUES_FILE PATH_TO_EXPORT_LIST";

    public enum Mode { SHOW_WORKSPACES, SHOW_OUTPUTS, EXPORT }

    public CommandLineOptions {
        targetWorkspaces = List.copyOf(targetWorkspaces);
    }

    public Mode mode() {
        if (showWorkspaces) {
            return Mode.SHOW_WORKSPACES;
        }
        return showOutputs ? Mode.SHOW_OUTPUTS : Mode.EXPORT;
    }

    /**
     * @throws InputException when the positional arguments do not fit the requested mode
     */
    public static CommandLineOptions parse(ApplicationArguments args) {
        boolean showWorkspaces = args.containsOption("show-workspaces");
        boolean showOutputs = args.containsOption("show-outputs");
        List<String> positional = args.getNonOptionArgs();
        rejectDetachedValues(args, positional);
        List<String> workspaces = workspaceNames(args);

        if (showWorkspaces && showOutputs) {
            throw new InputException("--show-workspaces and --show-outputs cannot be combined\n" + USAGE);
        }

        Path outputs = null;
        Path exportList = null;
        if (showOutputs) {
            if (positional.size() != 1 && positional.size() != 2) {
                throw new InputException("--show-outputs needs PATH_TO_OUTPUT_VALUES_FILE\n" + USAGE);
            }
            outputs = Path.of(positional.get(0));
        } else if (!showWorkspaces) {
            if (positional.size() != 2) {
                throw new InputException("expected PATH_TO_OUTPUT_VALUES_FILE and PATH_TO_EXPORT_LIST\n" + USAGE);
            }
            if (workspaces.isEmpty()) {
                throw new InputException("--target-workspaces is required\n" + USAGE);
            }
            outputs = Path.of(positional.get(0));
            exportList = Path.of(positional.get(1));
        }

        return new CommandLineOptions(outputs, exportList, workspaces,
                args.containsOption("allow-update"), args.containsOption("info-log"), showOutputs, showWorkspaces);
    }

    /**
     * Options take their value after {@code =}. A value passed as the next word, or a short flag, would
     * otherwise surface as a confusing count of positional arguments.
     */
    private static void rejectDetachedValues(ApplicationArguments args, List<String> positional) {
        for (String arg : positional) {
            if (arg.startsWith("-") && arg.length() > 1) {
                throw new InputException("unknown option '" + arg + "': only long options are supported, "
                        + "e.g. --target-workspaces=NAME1,NAME2\n" + USAGE);
            }
        }
        List<String> values = args.getOptionValues("target-workspaces");
        if (values != null && values.stream().allMatch(String::isBlank)) {
            throw new InputException("--target-workspaces needs its value after '=', "
                    + "e.g. --target-workspaces=NAME1,NAME2\n" + USAGE);
        }
    }

    private static List<String> workspaceNames(ApplicationArguments args) {
        List<String> values = args.getOptionValues("target-workspaces");
        if (values == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String value : values) {
            for (String name : value.split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }
        return new ArrayList<>(names);
    }
}
