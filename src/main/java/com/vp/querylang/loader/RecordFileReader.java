package com.vp.querylang.loader;

import com.vp.querylang.QueryLanguageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads records to match from a YAML file: a list of flat maps, one per record.
 * Scalar values are converted to strings; {@code null} values are dropped.
 */
public class RecordFileReader {

    private static final Logger log = LoggerFactory.getLogger(RecordFileReader.class);

    public List<Map<String, String>> read(String filePath) {
        try (InputStream input = new FileInputStream(filePath)) {
            List<Map<String, String>> records = read(input);
            log.info("Read {} record(s) from {}", records.size(), filePath);
            return records;
        } catch (IOException e) {
            throw new QueryLanguageException("Cannot read record file " + filePath, e);
        }
    }

    public List<Map<String, String>> read(InputStream input) {
        Object data;
        try {
            data = new Yaml().load(input);
        } catch (YAMLException e) {
            throw new QueryLanguageException("Invalid record file: " + e.getMessage(), e);
        }

        if (data == null) {
            return List.of();
        }
        if (!(data instanceof List)) {
            throw new QueryLanguageException("Record file must contain a list of records");
        }

        List<Map<String, String>> records = new ArrayList<>();
        int index = 0;
        for (Object item : (List<?>) data) {
            if (!(item instanceof Map)) {
                throw new QueryLanguageException("Record " + index + " is not a map");
            }
            Map<String, String> record = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) item).entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    record.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
                }
            }
            records.add(Collections.unmodifiableMap(record));
            index++;
        }
        return records;
    }
}
