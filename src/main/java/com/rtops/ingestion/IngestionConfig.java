package com.rtops.ingestion;

import com.rtops.ingestion.parsers.HeaderSynonyms;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the import pipeline: spreadsheet header synonyms.
 */
@Configuration
public class IngestionConfig {
    
    @Value("${rtops.import.header-synonyms.id:technique id,external id,id,external_id}")
    private List<String> idSynonyms;
    
    @Value("${rtops.import.header-synonyms.name:technique name,technique,name}")
    private List<String> nameSynonyms;
    
    @Value("${rtops.import.header-synonyms.description:description,technique description}")
    private List<String> descriptionSynonyms;
    
    @Value("${rtops.import.header-synonyms.tactics:tactics,tactic,domain tactics}")
    private List<String> tacticsSynonyms;
    
    @Bean
    public HeaderSynonyms headerSynonyms() {
        Map<HeaderSynonyms.Column, List<String>> synonyms = new EnumMap<>(HeaderSynonyms.Column.class);
        synonyms.put(HeaderSynonyms.Column.ID, idSynonyms);
        synonyms.put(HeaderSynonyms.Column.NAME, nameSynonyms);
        synonyms.put(HeaderSynonyms.Column.DESCRIPTION, descriptionSynonyms);
        synonyms.put(HeaderSynonyms.Column.TACTICS, tacticsSynonyms);
        return new HeaderSynonyms(synonyms);
    }
}
