package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MlScoreResponse(
        Double score,
        Integer modelSamples,
        String error
) {
}
