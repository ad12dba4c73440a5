package com.bistroAssist.queryDemo.llm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {

    @JsonProperty("model")
    private String model;

    @JsonProperty("data")
    private List<Item> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        @JsonProperty("index")
        private Integer index;

        @JsonProperty("embedding")
        private List<Double> embedding;
    }

    /**
     * @return the first embedding as a float array, or null when the response carries none
     */
    public float[] firstVector() {
        if (data == null || data.isEmpty() || data.get(0).getEmbedding() == null) {
            return null;
        }
        List<Double> values = data.get(0).getEmbedding();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
