package com.secrecon.store;

import java.util.Optional;

/** Optional source of standard concept labels, used when no presentation label exists. */
@FunctionalInterface
public interface LabelLookup {

    LabelLookup NONE = tag -> Optional.empty();

    Optional<String> labelFor(String tag);
}
