package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.FieldValue;

/**
 * Converts one raw field value into its canonical form or a failure marker.
 * Implementations are pure and thread-safe.
 *
 * @param <T> canonical type produced
 */
public interface FieldNormalizer<T> {

    FieldValue<T> normalize(Object rawValue);
}
