package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Serializes the structured history and metadata of a transaction to the
 * jsonb columns and back. Nothing outside the persistence layer sees the text.
 */
@Component
@RequiredArgsConstructor
class TransactionJsonCodec {

    private static final TypeReference<List<StateTransition>> HISTORY_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    String writeHistory(List<StateTransition> history) {
        return write(history);
    }

    String writeMetadata(Map<String, String> metadata) {
        return write(metadata == null ? Map.of() : metadata);
    }

    PayoutTransaction toDomain(TransactionEntity entity) {
        return entity.toDomain(
                read(entity.getStateHistory(), HISTORY_TYPE),
                read(entity.getMetadata(), METADATA_TYPE));
    }

    TransactionEntity toEntity(PayoutTransaction tx) {
        return TransactionEntity.fromDomain(tx, writeHistory(tx.getStateHistory()), writeMetadata(tx.getMetadata()));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt transaction column: " + e.getOriginalMessage(), e);
        }
    }
}
