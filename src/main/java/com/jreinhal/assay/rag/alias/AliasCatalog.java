package com.jreinhal.assay.rag.alias;

import java.util.List;

/**
 * Read access to the canonical metric catalog and its approved aliases.
 */
@FunctionalInterface
public interface AliasCatalog {

    List<CatalogEntry> entries();

    /**
     * Canonical key with its display name and approved aliases, all as stored (not folded).
     */
    record CatalogEntry(String canonicalKey, String displayName, List<String> aliases) {

        public CatalogEntry {
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }
}
