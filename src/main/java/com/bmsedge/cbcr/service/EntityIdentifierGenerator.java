package com.bmsedge.cbcr.service;

/**
 * Source of the entity identifier written into the XBRL context.
 */
@FunctionalInterface
public interface EntityIdentifierGenerator {

    String nextIdentifier();
}
