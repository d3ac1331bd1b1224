package com.tfve.sync.app;

import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.input.OutputValue;

import java.util.List;

/**
 * Text shown by {@code --show-outputs}.
 */
final class OutputListing {

    private OutputListing() {
    }

    static String format(List<OutputValue> outputs, ValueCodec codec) {
        StringBuilder sb = new StringBuilder();
        sb.append("Number of outputs: ").append(outputs.size()).append('.').append(System.lineSeparator());
        int i = 0;
        for (OutputValue output : outputs) {
            sb.append("--- ").append(++i).append(" ---").append(System.lineSeparator());
            sb.append("name : ").append(output.name()).append(System.lineSeparator());
            sb.append("value: ").append(codec.toJsonNode(output.value())).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
