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


package dev.mars.aegis.gateway;

import io.vertx.core.Future;

/**
 * Wire access to the data gateway.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public interface GatewayTransport {

    /**
     * Sends one attempt of an RPC request. The future succeeds with the decoded response
     * payload, which may be null for an empty body.
     */
    Future<Object> send(GatewayServiceConfig service, RpcRequest request);

    Future<ServiceDefinition> describe(GatewayServiceConfig service);

    /**
     * @return true when the gateway answered its health check with 200
     */
    Future<Boolean> healthCheck();

    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
