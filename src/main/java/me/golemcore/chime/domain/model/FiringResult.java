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
 * Outcome of one firing together with the failure classification and a short
 * human-readable detail.
 */
public record FiringResult(FiringOutcome outcome, FailureKind failureKind, String detail) {

    public static FiringResult success() {
        return new FiringResult(FiringOutcome.SUCCESS, null, null);
    }

    public static FiringResult skipped(String reason) {
        return new FiringResult(FiringOutcome.SKIPPED, null, reason);
    }

    public static FiringResult failed(FailureKind kind, String detail) {
        return new FiringResult(FiringOutcome.FAILED, kind, detail);
    }

    public boolean isSuccess() {
        return outcome == FiringOutcome.SUCCESS;
    }

    /**
     * Whether the message may have reached its destination.
     */
    public boolean mayHaveDelivered() {
        return isSuccess() || failureKind == FailureKind.DELIVERY_UNCONFIRMED;
    }
}
