package com.gillianbc.rothprojection.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.rothprojection.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one JSON document per tax year into {@link ReferenceTables}.
 */
@Slf4j
@RequiredArgsConstructor
public class ReferenceTableLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public ReferenceTables load(List<String> locations) {
        if (locations == null || locations.isEmpty()) {
            throw new ConfigurationException("no reference table locations configured");
        }
        List<TaxYearTables> tables = new ArrayList<>();
        for (String location : locations) {
            tables.add(read(location));
        }
        return new ReferenceTables(tables);
    }

    private TaxYearTables read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("reference tables not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            TaxYearTables tables = objectMapper.readValue(in, TaxYearTables.class);
            if (tables.getTaxYear() == 0) {
                throw new ConfigurationException("reference tables at " + location + " have no taxYear");
            }
            log.info("Loaded reference tables for tax year {} from {}", tables.getTaxYear(), location);
            return tables;
        } catch (IOException e) {
            throw new ConfigurationException("unreadable reference tables at " + location, e);
        }
    }
}
