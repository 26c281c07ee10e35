package com.glottocatalog.config;

import com.glottocatalog.service.FieldMapping;
import com.glottocatalog.service.RecordParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ImportConfig {

    @Bean
    public FieldMapping fieldMapping() {
        return FieldMapping.glottolog();
    }

    @Bean
    public RecordParser recordParser(FieldMapping fieldMapping, CatalogProperties properties) {
        return new RecordParser(fieldMapping, properties.getImport().getMinimumFields());
    }
}
