package me.golemcore.commentator.domain.service;

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

import me.golemcore.commentator.domain.exception.StorageException;

import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Helpers shared by the file-backed stores.
 */
final class StorageKeys {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    static final String JSONL_EXTENSION = ".jsonl";
    static final String JSON_EXTENSION = ".json";

    private StorageKeys() {
    }

    /**
     * File name stem for an owner or entity key. Characters outside
     * {@code [A-Za-z0-9._-]} become underscores.
     */
    static String fileStem(String key) {
        if (key == null || key.isBlank()) {
            return "_";
        }
        return UNSAFE.matcher(key.trim()).replaceAll("_");
    }

    /**
     * Run a blocking storage call, unwrapping the future's failure into a
     * {@link StorageException}.
     */
    static <T> T call(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException(operation + " failed: " + cause.getMessage(), cause);
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
