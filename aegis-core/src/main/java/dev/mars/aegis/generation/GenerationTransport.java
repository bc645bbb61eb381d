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

import io.vertx.core.Future;

import java.util.function.Consumer;

/**
 * One attempt at a generation against the AI service.
 *
 * <p>Implementations fail their future with a
 * {@link dev.mars.aegis.core.exceptions.CallException} carrying the right
 * {@link dev.mars.aegis.core.ErrorKind}; unrecognised failures are treated as
 * upstream errors.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public interface GenerationTransport {

    Future<GenerationResult> generate(GenerationRequest request);

    /**
     * Streams the generation, handing each text fragment to {@code fragments} as it arrives.
     * The returned result carries the full concatenated content.
     */
    Future<GenerationResult> generateStream(GenerationRequest request, Consumer<String> fragments);

    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
