package com.apex.gate.service.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonLogCandidateResultSink implements CandidateResultSink {

    private final ObjectMapper objectMapper;

    @Override
    public void save(CandidateResult result) {
        try {
            log.info("Candidate result {}: {}", result.runId(), objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize candidate result " + result.runId(), e);
        }
    }
}
