package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.FieldType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Normalizer for each {@link FieldType}. Shared, stateless instances.
 */
public final class FieldNormalizers {

    private static final Map<FieldType, FieldNormalizer<?>> BY_TYPE = new EnumMap<>(FieldType.class);

    static {
        BY_TYPE.put(FieldType.TEXT, new TextNormalizer());
        BY_TYPE.put(FieldType.CURRENCY, new CurrencyNormalizer());
        BY_TYPE.put(FieldType.DATE, new DateNormalizer());
        BY_TYPE.put(FieldType.SECTOR, new CategoryNormalizer(Vocabularies.SECTORS));
        BY_TYPE.put(FieldType.STAGE, new CategoryNormalizer(Vocabularies.DEAL_STAGES));
        BY_TYPE.put(FieldType.STATUS, new CategoryNormalizer(Vocabularies.WORK_ORDER_STATUSES));
    }

    private FieldNormalizers() {}

    public static FieldNormalizer<?> forType(FieldType type) {
        return BY_TYPE.get(type);
    }
}
