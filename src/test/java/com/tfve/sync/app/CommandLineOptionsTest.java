package com.tfve.sync.app;

import com.tfve.sync.input.InputException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineOptionsTest {

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(new DefaultApplicationArguments(args));
    }

    @Test
    void parsesExportInvocation() {
        CommandLineOptions options = parse("--target-workspaces=app-dev, app-prod", "--target-workspaces=app-dev",
                "--allow-update", "--info-log", "outputs.json", "export_list.txt");

        assertThat(options.mode()).isEqualTo(CommandLineOptions.Mode.EXPORT);
        assertThat(options.outputValuesFile()).isEqualTo(Path.of("outputs.json"));
        assertThat(options.exportList()).isEqualTo(Path.of("export_list.txt"));
        assertThat(options.targetWorkspaces()).containsExactly("app-dev", "app-prod");
        assertThat(options.allowUpdate()).isTrue();
        assertThat(options.infoLog()).isTrue();
    }

    @Test
    void flagsDefaultToOff() {
        CommandLineOptions options = parse("--target-workspaces=ws", "o.json", "l.txt");

        assertThat(options.allowUpdate()).isFalse();
        assertThat(options.infoLog()).isFalse();
        assertThat(options.showOutputs()).isFalse();
        assertThat(options.showWorkspaces()).isFalse();
    }

    @Test
    void exportNeedsTargetWorkspaces() {
        assertThatThrownBy(() -> parse("o.json", "l.txt"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("--target-workspaces");
    }

    @Test
    void exportNeedsBothFiles() {
        assertThatThrownBy(() -> parse("--target-workspaces=ws", "o.json"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("usage");
    }

    @Test
    void showOutputsNeedsOnlyTheOutputFile() {
        CommandLineOptions options = parse("--show-outputs", "o.json");

        assertThat(options.mode()).isEqualTo(CommandLineOptions.Mode.SHOW_OUTPUTS);
        assertThat(options.outputValuesFile()).isEqualTo(Path.of("o.json"));
        assertThat(options.exportList()).isNull();
    }

    @Test
    void showWorkspacesNeedsNoFiles() {
        CommandLineOptions options = parse("--show-workspaces");

        assertThat(options.mode()).isEqualTo(CommandLineOptions.Mode.SHOW_WORKSPACES);
        assertThat(options.outputValuesFile()).isNull();
    }

    @Test
    void showModesCannotBeCombined() {
        assertThatThrownBy(() -> parse("--show-workspaces", "--show-outputs", "o.json"))
                .isInstanceOf(InputException.class);
    }

    @Test
    void workspaceNamesGivenAsNextWordAreRejectedWithHint() {
        assertThatThrownBy(() -> parse("--target-workspaces", "ws1", "o.json", "l.txt"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("--target-workspaces needs its value after '='")
                .hasMessageNotContaining("expected PATH_TO_OUTPUT_VALUES_FILE");
    }

    @Test
    void shortFlagsAreNamedInTheError() {
        assertThatThrownBy(() -> parse("-t", "ws1", "o.json", "l.txt"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("unknown option '-t'")
                .hasMessageContaining("--target-workspaces=NAME1,NAME2");
        assertThatThrownBy(() -> parse("--target-workspaces=ws1", "-u", "o.json", "l.txt"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("unknown option '-u'");
    }
}
