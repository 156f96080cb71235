package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.service.RawRecordMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads raw district rows from a CSV export with a header line.
 *
 * Columns are matched by header name, so column order does not matter. Short rows
 * are kept; their missing columns are left absent and degrade during validation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvRowSource implements RowSource {

    private final DistrictEngineProperties properties;
    private final RawRecordMapper mapper;

    @Override
    public SourceMode mode() {
        return SourceMode.CSV;
    }

    @Override
    public List<RawRecord> fetchRows() {
        Path path = Paths.get(properties.getSource().getCsvPath());
        log.info("Reading district rows from CSV: {}", path);

        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in).build()) {
            return readRows(reader);
        } catch (IOException | CsvValidationException e) {
            throw new SourceUnavailableException("Cannot read CSV source " + path + ": " + e.getMessage(), e);
        }
    }

    private List<RawRecord> readRows(CSVReader reader) throws IOException, CsvValidationException {
        String[] header = reader.readNext();
        if (header == null) {
            log.warn("CSV source is empty");
            return List.of();
        }
        for (int i = 0; i < header.length; i++) {
            header[i] = header[i].replace("\uFEFF", "").trim();
        }

        List<RawRecord> records = new ArrayList<>();
        int blank = 0;
        String[] cols;
        while ((cols = reader.readNext()) != null) {
            if (isBlank(cols)) {
                blank++;
                continue;
            }
            records.add(mapper.map(toRow(header, cols)));
        }

        log.info("Parsed {} CSV rows, {} blank lines skipped", records.size(), blank);
        return records;
    }

    private Map<String, String> toRow(String[] header, String[] cols) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < header.length && i < cols.length; i++) {
            row.put(header[i], cols[i].trim());
        }
        return row;
    }

    private boolean isBlank(String[] cols) {
        return cols.length == 1 && cols[0].isBlank();
    }
}
