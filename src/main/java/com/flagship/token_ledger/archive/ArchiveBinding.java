package com.flagship.token_ledger.archive;

import java.util.Objects;

/**
 * Whether the ledger has an archive yet. Starts {@link Unbound} and becomes
 * {@link Bound} the first time a migration provisions one.
 */
public sealed interface ArchiveBinding permits ArchiveBinding.Unbound, ArchiveBinding.Bound {

    ArchiveBinding UNBOUND = new Unbound();

    static ArchiveBinding bound(ArchiveClient client) {
        return new Bound(client);
    }

    final class Unbound implements ArchiveBinding {
        private Unbound() {
        }

        @Override
        public String toString() {
            return "Unbound";
        }
    }

    final class Bound implements ArchiveBinding {
        private final ArchiveClient client;

        private Bound(ArchiveClient client) {
            this.client = Objects.requireNonNull(client, "client");
        }

        public ArchiveClient client() {
            return client;
        }

        @Override
        public String toString() {
            return "Bound(" + client.id() + ")";
        }
    }
}
