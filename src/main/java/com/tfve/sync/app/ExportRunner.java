package com.tfve.sync.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfve.sync.core.client.RemoteVariableClient;
import com.tfve.sync.core.model.SyncResult;
import com.tfve.sync.core.model.VariableTarget;
import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.engine.SyncEngine;
import com.tfve.sync.engine.SyncException;
import com.tfve.sync.input.ExportListReader;
import com.tfve.sync.input.InputException;
import com.tfve.sync.input.OutputDocumentReader;
import com.tfve.sync.input.OutputValue;
import com.tfve.sync.input.TargetAssembler;
import com.tfve.sync.tfc.client.TfcApiException;
import com.tfve.sync.tfc.client.TfcWorkspaceDirectory;
import com.tfve.sync.tfc.client.Workspace;
import com.tfve.sync.tfc.config.TfvarExportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs one command line invocation.
 *
 * <h2>Export flow</h2>
 * <ol>
 *   <li>Read the output document and the export list, join them into targets.</li>
 *   <li>Resolve every target workspace name to an id. Nothing is written until all names resolve.</li>
 *   <li>Sync each workspace in turn and print its {@link SyncReport}.</li>
 * </ol>
 *
 * <h2>Exit codes</h2>
 * <ul>
 *   <li>0: every variable was applied or deliberately left unchanged</li>
 *   <li>1: a variable failed, or a workspace run aborted</li>
 *   <li>2: unusable input: arguments, files, credentials, workspace names</li>
 * </ul>
 */
@Component
public class ExportRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExportRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SYNC_FAILED = 1;
    static final int EXIT_INPUT_ERROR = 2;

    private static final String APP_LOGGER = "com.tfve.sync";

    private final TfvarExportProperties props;
    private final OutputDocumentReader outputReader;
    private final ExportListReader exportListReader;
    private final TargetAssembler assembler;
    private final TfcWorkspaceDirectory directory;
    private final RemoteVariableClient client;
    private final ValueCodec codec;
    private final ObjectMapper mapper;
    private final LoggingSystem loggingSystem;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public ExportRunner(TfvarExportProperties props,
                        OutputDocumentReader outputReader,
                        ExportListReader exportListReader,
                        TargetAssembler assembler,
                        TfcWorkspaceDirectory directory,
                        RemoteVariableClient client,
                        ValueCodec codec,
                        ObjectMapper mapper,
                        LoggingSystem loggingSystem) {
        this(props, outputReader, exportListReader, assembler, directory, client, codec, mapper, loggingSystem,
                System.out);
    }

    ExportRunner(TfvarExportProperties props,
                 OutputDocumentReader outputReader,
                 ExportListReader exportListReader,
                 TargetAssembler assembler,
                 TfcWorkspaceDirectory directory,
                 RemoteVariableClient client,
                 ValueCodec codec,
                 ObjectMapper mapper,
                 LoggingSystem loggingSystem,
                 PrintStream out) {
        this.props = props;
        this.outputReader = outputReader;
        this.exportListReader = exportListReader;
        this.assembler = assembler;
        this.directory = directory;
        this.client = client;
        this.codec = codec;
        this.mapper = mapper;
        this.loggingSystem = loggingSystem;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            CommandLineOptions options = CommandLineOptions.parse(args);
            if (options.infoLog()) {
                loggingSystem.setLogLevel(APP_LOGGER, LogLevel.INFO);
            }
            switch (options.mode()) {
                case SHOW_WORKSPACES -> showWorkspaces();
                case SHOW_OUTPUTS -> showOutputs(options);
                case EXPORT -> export(options);
            }
        } catch (InputException e) {
            log.error("{}", e.getMessage());
            exitCode = EXIT_INPUT_ERROR;
        } catch (TfcApiException e) {
            log.error("API call failed: {}", e.getMessage());
            exitCode = EXIT_SYNC_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void showWorkspaces() {
        requireCredentials();
        List<Workspace> workspaces = directory.listWorkspaces().collectList().block();
        out.println(toJson(workspaces));
    }

    private void showOutputs(CommandLineOptions options) {
        List<OutputValue> outputs = outputReader.read(options.outputValuesFile());
        out.print(OutputListing.format(outputs, codec));
    }

    private void export(CommandLineOptions options) {
        List<OutputValue> outputs = outputReader.read(options.outputValuesFile());
        List<VariableTarget> targets = assembler.assemble(exportListReader.read(options.exportList()), outputs);
        requireCredentials();

        Map<String, String> workspaceIds = directory.resolveWorkspaceIds(options.targetWorkspaces()).block();

        boolean allowUpdate = props.isAllowUpdate() || options.allowUpdate();
        SyncEngine engine = new SyncEngine(client, codec, allowUpdate, props.getFailurePolicy());

        workspaceIds.forEach((name, id) -> {
            try {
                SyncResult result = engine.sync(id, targets).block();
                out.println(toJson(SyncReport.of(name, id, result, codec, Instant.now())));
                if (result.hasFailures()) {
                    exitCode = EXIT_SYNC_FAILED;
                }
            } catch (SyncException e) {
                log.error("Workspace {} ({}) aborted: {}", name, id, e.getMessage());
                exitCode = EXIT_SYNC_FAILED;
            }
        });
    }

    private void requireCredentials() {
        if (props.getToken() == null || props.getToken().isBlank()) {
            throw new InputException("TFVE_TOKEN is not set");
        }
        if (props.getOrganizationName() == null || props.getOrganizationName().isBlank()) {
            throw new InputException("TFVE_ORGANIZATION_NAME is not set");
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + value.getClass().getSimpleName(), e);
        }
    }
}
