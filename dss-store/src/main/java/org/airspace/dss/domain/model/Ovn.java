package org.airspace.dss.domain.model;

/**
 * Opaque version token.
 *
 * Derived from an entity's last-modified timestamp and id on every read; never stored.
 * Callers echo it back on their next update.
 */
public record Ovn(String value) {
    public Ovn {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OVN value must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
