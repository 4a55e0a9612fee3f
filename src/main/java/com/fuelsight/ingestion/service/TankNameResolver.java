package com.fuelsight.ingestion.service;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the tank name typed on a manual dip form to a fuel tank id.
 */
public interface TankNameResolver {

    /**
     * @param tankName name as entered; matching ignores case and surrounding whitespace
     * @return the tank id, or empty when no tank has that name
     */
    Optional<UUID> resolve(String tankName);
}
