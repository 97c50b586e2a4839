package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.domainkit.common.types.CharSequenceType;

import java.util.UUID;

public class ProductId extends CharSequenceType<ProductId> {
    protected ProductId(CharSequence value) {
        super(value);
    }

    public static ProductId random() {
        return new ProductId(UUID.randomUUID().toString());
    }

    @JsonCreator
    public static ProductId of(String id) {
        return new ProductId(id);
    }
}
