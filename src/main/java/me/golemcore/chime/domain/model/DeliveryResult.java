package me.golemcore.chime.domain.model;

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

/**
 * Result reported by the message transport.
 *
 * @param parts
 *            number of ordered parts the content was delivered as
 */
public record DeliveryResult(boolean delivered, FailureKind failureKind, String error, int parts) {

    public static DeliveryResult delivered(int parts) {
        return new DeliveryResult(true, null, null, parts);
    }

    public static DeliveryResult failed(FailureKind kind, String error) {
        return new DeliveryResult(false, kind, error, 0);
    }
}
