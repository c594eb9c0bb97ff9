package me.golemcore.chime.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chime.domain.model.DeliveryResult;

import java.util.concurrent.CompletableFuture;

/**
 * Platform transport that performs the scheduled action. Oversized content may
 * be split into ordered parts that are delivered as a set.
 */
public interface MessageTransportPort {

    String getTransportId();

    boolean isAvailable();

    /**
     * Whether the destination is syntactically usable for this transport.
     */
    boolean isValidDestination(String destination);

    CompletableFuture<DeliveryResult> send(String destination, String content);
}
