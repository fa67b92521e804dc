package me.golemcore.commentator.adapter.outbound.delivery;

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

import me.golemcore.commentator.port.outbound.DeliveryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivery adapter that writes commentary to the application log. Replace
 * with a channel-specific adapter to post it elsewhere.
 */
@Component
@Slf4j
public class LoggingDeliveryAdapter implements DeliveryPort {

    @Override
    public void deliver(String ownerKey, String header, String text) {
        String title = header != null && !header.isBlank() ? header : ownerKey;
        log.info("[Cycle] {}\n{}", title, text);
    }
}
