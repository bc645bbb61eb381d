/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.aegis.generation;

import java.util.List;

/**
 * Sampling and safety options for a generation request.
 *
 * <p>Null numeric fields mean "use the transport's configured default".</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record GenerationOptions(
        Integer maxTokens,
        Double temperature,
        Double topP,
        Integer topK,
        List<String> stopSequences,
        List<SafetySetting> safetySettings
) {

    public static final double DEFAULT_TOP_P = 0.8;
    public static final int DEFAULT_TOP_K = 40;

    public GenerationOptions {
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
        safetySettings = safetySettings == null || safetySettings.isEmpty()
                ? SafetySetting.DEFAULTS : List.copyOf(safetySettings);
    }

    public static GenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double effectiveTopP() {
        return topP != null ? topP : DEFAULT_TOP_P;
    }

    public int effectiveTopK() {
        return topK != null ? topK : DEFAULT_TOP_K;
    }

    public static final class Builder {
        private Integer maxTokens;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private List<String> stopSequences;
        private List<SafetySetting> safetySettings;

        private Builder() {
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder safetySettings(List<SafetySetting> safetySettings) {
            this.safetySettings = safetySettings;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(maxTokens, temperature, topP, topK, stopSequences, safetySettings);
        }
    }
}
