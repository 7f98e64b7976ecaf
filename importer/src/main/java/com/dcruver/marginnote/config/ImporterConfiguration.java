package com.dcruver.marginnote.config;

import com.dcruver.marginnote.domain.ContentGrouper;
import com.dcruver.marginnote.domain.Deduplicator;
import com.dcruver.marginnote.domain.MediaClassifier;
import com.dcruver.marginnote.domain.RecordMapper;
import com.dcruver.marginnote.domain.TextFeatureExtractor;
import com.dcruver.marginnote.io.ArchiveReader;
import com.dcruver.marginnote.plist.ArchivedBlobDecoder;
import com.dcruver.marginnote.plist.BinaryPlistParser;
import com.dcruver.marginnote.plist.KeyedArchiverResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the import core from {@link ImporterProperties}.
 */
@Configuration
@Slf4j
public class ImporterConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ArchiveReader archiveReader(ImporterProperties properties) {
        return new ArchiveReader(properties.getMaxEntrySize(), properties.getDatabaseEntryPatterns());
    }

    @Bean
    public BinaryPlistParser binaryPlistParser() {
        return new BinaryPlistParser();
    }

    @Bean
    public KeyedArchiverResolver keyedArchiverResolver(ImporterProperties properties) {
        return new KeyedArchiverResolver(properties.getMaxResolveDepth());
    }

    @Bean
    public ArchivedBlobDecoder archivedBlobDecoder(BinaryPlistParser parser, KeyedArchiverResolver resolver,
                                                   ImporterProperties properties) {
        if (properties.isStrictDecoding()) {
            log.info("Strict decoding enabled: malformed blobs fail the import");
        }
        return new ArchivedBlobDecoder(parser, resolver, properties.isStrictDecoding());
    }

    @Bean
    public TextFeatureExtractor textFeatureExtractor(ImporterProperties properties) {
        return new TextFeatureExtractor(properties.getLinkScheme());
    }

    @Bean
    public MediaClassifier mediaClassifier() {
        return new MediaClassifier();
    }

    @Bean
    public RecordMapper recordMapper(ArchivedBlobDecoder decoder, TextFeatureExtractor textFeatures,
                                     MediaClassifier mediaClassifier, ObjectMapper objectMapper) {
        return new RecordMapper(decoder, textFeatures, mediaClassifier, objectMapper);
    }

    @Bean
    public ContentGrouper contentGrouper() {
        return new ContentGrouper();
    }

    @Bean
    public Deduplicator deduplicator(ImporterProperties properties) {
        return new Deduplicator(properties.getReductionWarningThreshold());
    }
}
