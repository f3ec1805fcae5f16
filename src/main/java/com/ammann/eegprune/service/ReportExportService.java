/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.ReconciliationRecordDTO;
import com.ammann.eegprune.exception.PruningException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Writes reconciliation rows as CSV (header plus one line per row, column order fixed by
 * {@link ReconciliationRecordDTO}) or as a JSON array.
 */
@ApplicationScoped
public class ReportExportService {

    private static final Logger LOG = Logger.getLogger(ReportExportService.class);

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema =
            csvMapper.schemaFor(ReconciliationRecordDTO.class).withHeader();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public String toCsv(List<ReconciliationRecordDTO> records) {
        if (records.isEmpty()) {
            List<String> columns = new ArrayList<>();
            for (CsvSchema.Column column : schema) {
                columns.add(column.getName());
            }
            return String.join(String.valueOf(schema.getColumnSeparator()), columns) + "\n";
        }
        try {
            String csv = csvMapper.writer(schema).writeValueAsString(records);
            LOG.debugf("Exported %d reconciliation rows as CSV", records.size());
            return csv;
        } catch (JsonProcessingException e) {
            throw new PruningException("Failed to write reconciliation report as CSV", e);
        }
    }

    public String toJson(List<ReconciliationRecordDTO> records) {
        try {
            return jsonMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new PruningException("Failed to write reconciliation report as JSON", e);
        }
    }
}
