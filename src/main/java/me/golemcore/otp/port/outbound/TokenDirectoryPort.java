package me.golemcore.otp.port.outbound;

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

import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.DirectorySearchResult;

/**
 * Port for the directory that persists token entries.
 *
 * <p>
 * The token service performs read-then-write sequences (partial update
 * validation, manager re-assignment) without locking. Implementations are
 * responsible for making concurrent writes to the same entry safe.
 */
public interface TokenDirectoryPort {

    /**
     * Store a new entry.
     *
     * @return the stored entry as read back from the directory
     * @throws me.golemcore.otp.domain.exception.DuplicateEntryException
     *             when an entry with the same id exists
     */
    DirectoryEntry create(DirectoryEntry entry);

    /**
     * @throws me.golemcore.otp.domain.exception.NotFoundException
     *             when no entry has this id
     */
    DirectoryEntry read(String id);

    /**
     * Replace the given attributes of an entry. An attribute mapped to an empty
     * list is removed.
     *
     * @return the entry after the update
     */
    DirectoryEntry update(String id, DirectoryEntry changes);

    void delete(String id);

    /**
     * Find entries matching an RFC 4515 filter.
     */
    DirectorySearchResult search(String filter, int sizeLimit);

    /**
     * Canonical directory reference of a token entry.
     */
    String referenceOf(String id);
}
