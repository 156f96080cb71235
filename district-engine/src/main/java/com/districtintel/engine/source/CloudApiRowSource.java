package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.service.RawRecordMapper;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the cloud data API, which returns a JSON array of row objects.
 *
 * Transient failures are retried by Resilience4j (instance "cloudApi"). Once the
 * retries are spent the exception reaches the router.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CloudApiRowSource implements RowSource {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final DistrictEngineProperties properties;
    private final RawRecordMapper mapper;

    @Override
    public SourceMode mode() {
        return SourceMode.CLOUD;
    }

    @Override
    @Retry(name = "cloudApi")
    public List<RawRecord> fetchRows() {
        String url = properties.getSource().getCloudApiUrl();
        log.info("Fetching district rows from cloud API: {}", url);

        JsonNode body = restTemplate.getForObject(url, JsonNode.class);
        if (body == null || !body.isArray()) {
            throw new SourceUnavailableException("Cloud API did not return a JSON array: " + url);
        }

        List<RawRecord> records = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            // non-object elements become empty rows and are rejected by the validator
            Map<String, Object> row = node.isObject() ? objectMapper.convertValue(node, ROW_TYPE) : Map.of();
            records.add(mapper.map(row));
        }

        log.info("Cloud API returned {} rows", records.size());
        return records;
    }
}
