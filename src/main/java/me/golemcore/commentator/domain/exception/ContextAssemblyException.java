package me.golemcore.commentator.domain.exception;

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
 * No prompt can be built at all, for example when there are no event lines
 * and the owner has no recorded history.
 */
public class ContextAssemblyException extends RuntimeException {

    public ContextAssemblyException(String message) {
        super(message);
    }

    public ContextAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
