package dev.scriptorium.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Descriptor written next to a local collection so later runs can check they embed with the same
 * model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CollectionManifest(String collection, String embeddingModel, int dimension) {}
