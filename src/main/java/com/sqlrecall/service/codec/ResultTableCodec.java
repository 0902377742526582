package com.sqlrecall.service.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.sqlrecall.model.ResultTable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes result tables as GZIP-compressed JSON.
 *
 * Cell values keep their Java type: anything JSON cannot restore on its own
 * (Long, BigDecimal, dates and times) is written with its class name, e.g.
 * {@code ["java.lang.Long", 5]}. Strings, booleans, Integer and Double stay bare.
 */
@Component
public class ResultTableCodec {

    private static final TypeReference<List<String>> COLUMN_LIST = new TypeReference<>() {
    };

    // Cell types a cached result may carry
    private static final PolymorphicTypeValidator CELL_TYPES = BasicPolymorphicTypeValidator.builder()
            .allowIfSubType("java.lang.")
            .allowIfSubType("java.math.")
            .allowIfSubType("java.time.")
            .allowIfSubType("java.sql.")
            .allowIfSubType("java.util.")
            .build();

    private final ObjectMapper objectMapper;
    private final ObjectMapper payloadMapper;

    public ResultTableCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.payloadMapper = objectMapper.copy()
                .activateDefaultTyping(CELL_TYPES, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    }

    public byte[] encode(ResultTable table) throws CachePayloadException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(payloadMapper.writeValueAsBytes(table));
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CachePayloadException("Failed to serialize result table", e);
        }
    }

    public ResultTable decode(byte[] payload) throws CachePayloadException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(payload))) {
            return payloadMapper.readValue(gzipIn.readAllBytes(), ResultTable.class);
        } catch (IOException e) {
            throw new CachePayloadException("Failed to deserialize cached result table", e);
        }
    }

    /**
     * Column manifest as a JSON array, stored next to the payload.
     */
    public String encodeColumns(List<String> columns) throws CachePayloadException {
        try {
            return objectMapper.writeValueAsString(columns);
        } catch (IOException e) {
            throw new CachePayloadException("Failed to serialize column manifest", e);
        }
    }

    public List<String> decodeColumns(String manifest) throws CachePayloadException {
        if (manifest == null || manifest.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(manifest, COLUMN_LIST);
        } catch (IOException e) {
            throw new CachePayloadException("Failed to deserialize column manifest", e);
        }
    }
}
