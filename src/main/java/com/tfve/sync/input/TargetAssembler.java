package com.tfve.sync.input;

import com.tfve.sync.core.model.VariableTarget;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the export list with the output document into the variables to export.
 */
public class TargetAssembler {

    /**
     * @return one target per export-list entry, in export-list order
     * @throws InputException when an entry names an output that is missing or sensitive
     */
    public List<VariableTarget> assemble(Map<String, ExportListEntry> exportList, List<OutputValue> outputs) {
        Map<String, OutputValue> byName = new HashMap<>();
        outputs.forEach(o -> byName.put(o.name(), o));

        List<VariableTarget> targets = new ArrayList<>(exportList.size());
        for (ExportListEntry entry : exportList.values()) {
            OutputValue output = byName.get(entry.source());
            if (output == null) {
                throw new InputException("Output '" + entry.source()
                        + "' named in the export list is missing or sensitive");
            }
            targets.add(new VariableTarget(entry.destination(), entry.description(), output.value()));
        }
        return targets;
    }
}
