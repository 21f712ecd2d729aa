package com.acme.nummern.script.normalize;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Local name to canonical table id, rebuilt on every normalization pass. */
public final class AliasTable {
    private final Map<String, String> aliases = new HashMap<>();

    public void bind(String alias, String tableId) {
        aliases.put(alias, tableId);
    }

    public Optional<String> resolve(String alias) {
        return Optional.ofNullable(aliases.get(alias));
    }

    public int size() {
        return aliases.size();
    }
}
