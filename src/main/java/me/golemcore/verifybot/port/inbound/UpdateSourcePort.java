package me.golemcore.verifybot.port.inbound;

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

import me.golemcore.verifybot.domain.model.UpdateBatch;

/**
 * Ordered stream of platform updates, consumed from a durable cursor.
 */
public interface UpdateSourcePort {

    /**
     * Long-poll for updates after {@code cursor}. Blocks until updates exist or
     * the configured wait elapses.
     *
     * <p>
     * Transport failures and platform-reported errors are recoverable: the
     * source logs them, pauses briefly and returns an empty batch.
     *
     * @param cursor
     *            highest update id already processed, 0 when none
     * @return mapped updates, never {@code null}
     */
    UpdateBatch fetch(long cursor);
}
