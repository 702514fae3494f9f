package me.golemcore.otp.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.model.UserIdentity;
import me.golemcore.otp.port.outbound.IdentityPort;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves token ownership and management.
 *
 * <p>
 * Owners and managers are stored as canonical user references and shown to
 * callers as user identifiers. A token whose only manager is its owner is
 * self-managed; transferring ownership of such a token transfers management
 * with it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenOwnerResolver {

    private final IdentityPort identityPort;
    private final TokenDirectoryPort directoryPort;

    /**
     * Owner and managers of a new token after defaults were applied. The owner
     * is still a user identifier; the managers are references.
     */
    public record Assignment(String owner, List<String> managedBy) {
    }

    /**
     * Apply creation defaults. When the owner or the managers are missing and
     * the caller is a known user, the owner defaults to the caller, and the
     * managers default to the caller only if the caller ends up as the owner.
     */
    public Assignment applyCreateDefaults(String owner, List<String> managedBy, String caller) {
        if (owner != null && managedBy != null) {
            return new Assignment(owner, managedBy);
        }
        Optional<UserIdentity> current = caller != null ? identityPort.findUser(caller) : Optional.empty();
        if (current.isEmpty()) {
            return new Assignment(owner, managedBy);
        }
        UserIdentity user = current.get();
        String resolvedOwner = owner != null ? owner : user.uid();
        List<String> resolvedManagers = managedBy;
        if (resolvedManagers == null && user.uid().equals(resolvedOwner)) {
            resolvedManagers = List.of(user.reference());
        }
        return new Assignment(resolvedOwner, resolvedManagers);
    }

    /**
     * Resolve an owner identifier to its canonical reference.
     *
     * @return {@code null} when no owner is given
     * @throws NotFoundException
     *             when the owner does not exist
     */
    public String normalizeOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            return null;
        }
        try {
            return identityPort.resolveIdentity(owner);
        } catch (NotFoundException e) {
            throw NotFoundException.user(owner);
        }
    }

    /**
     * Decide the managers after an ownership change in an update.
     *
     * @return the new managers, or {@code null} to leave them unchanged
     */
    public List<String> reassignManagers(String id, String newOwner) {
        DirectoryEntry stored = directoryPort.read(id);
        String previousOwner = stored.getSingle(TokenAttributes.OWNER);
        List<String> previousManagers = stored.get(TokenAttributes.MANAGED_BY);

        // an entry with neither owner nor managers counts as self-managed
        boolean selfManaged = previousOwner == null
                ? previousManagers.isEmpty()
                : previousManagers.size() == 1 && previousManagers.get(0).equals(previousOwner);
        if (selfManaged && !newOwner.equals(previousOwner)) {
            log.debug("[OtpToken] Token {} is self-managed, moving management to the new owner", id);
            return List.of(newOwner);
        }
        return null;
    }

    /**
     * Convert owner and manager references of a view to user identifiers,
     * unless raw output was requested.
     */
    public TokenView denormalize(TokenView view, boolean raw) {
        if (raw) {
            return view;
        }
        if (view.getOwner() != null) {
            view.setOwner(identityPort.toIdentifier(view.getOwner()));
        }
        if (view.getManagedBy() != null) {
            view.setManagedBy(view.getManagedBy().stream()
                    .map(identityPort::toIdentifier)
                    .toList());
        }
        return view;
    }
}
