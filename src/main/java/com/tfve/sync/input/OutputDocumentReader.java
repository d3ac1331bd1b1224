package com.tfve.sync.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.core.value.ValueCodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the document written by {@code terraform output -json}.
 *
 * <pre>
 * {"name": {"sensitive": false, "type": ..., "value": ...}, ...}
 * </pre>
 *
 * Outputs flagged {@code "sensitive": true} are never returned.
 */
public class OutputDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(OutputDocumentReader.class);

    private final ValueCodec codec;

    public OutputDocumentReader(ValueCodec codec) {
        this.codec = codec;
    }

    /**
     * @return non-sensitive outputs in document order
     * @throws InputException when the file cannot be read or is not an object of outputs
     */
    public List<OutputValue> read(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException("Cannot read output values file " + path, e);
        }

        JsonNode root;
        try {
            root = codec.readTree(content);
        } catch (ValueCodecException e) {
            throw new InputException("Output values file " + path + " is not valid JSON", e);
        }
        if (!root.isObject()) {
            throw new InputException("Output values file " + path + " must contain a JSON object");
        }

        List<OutputValue> outputs = new ArrayList<>();
        int sensitive = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode output = f.getValue();
            if (output.path("sensitive").asBoolean(false)) {
                sensitive++;
                continue;
            }
            if (!output.has("value")) {
                throw new InputException("Output '" + f.getKey() + "' has no value in " + path);
            }
            outputs.add(new OutputValue(f.getKey(), codec.fromJsonNode(output.get("value"))));
        }

        log.info("Read {} outputs from {} ({} sensitive skipped)", outputs.size(), path, sensitive);
        return outputs;
    }
}
