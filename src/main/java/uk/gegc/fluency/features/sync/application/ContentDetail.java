package uk.gegc.fluency.features.sync.application;

import java.util.UUID;

/**
 * Read model of an item together with the sub-records of its type.
 */
public interface ContentDetail {

    UUID id();

    int version();
}
