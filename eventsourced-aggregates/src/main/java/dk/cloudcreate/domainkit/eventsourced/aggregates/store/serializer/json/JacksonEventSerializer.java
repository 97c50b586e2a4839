package dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.EventSerializer;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Jackson based {@link EventSerializer}.<br>
 * Events are serialized as an envelope that carries the Fully Qualified Class Name of the event next to its JSON payload:
 * <pre>{@code
 * {
 *   "eventType": "com.company.OrderAdded",
 *   "event": {"aggregateId": "order-1", "version": 1, "eventId": "...", "orderingCustomerId": "customer-1"}
 * }
 * }</pre>
 * The default {@link ObjectMapper} (see {@link #createDefaultObjectMapper()}) is field based, so events don't need getters or setters
 */
public class JacksonEventSerializer implements EventSerializer {
    public static final String EVENT_TYPE_FIELD = "eventType";
    public static final String EVENT_FIELD      = "event";

    private final ObjectMapper objectMapper;

    public JacksonEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create an {@link ObjectMapper} that reads and writes all fields (regardless of visibility), ignores getters and setters,
     * ignores unknown properties and supports the java.time types
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .addModule(new JavaTimeModule())
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public String serializeToString(Object event) {
        requireNonNull(event, "No event provided");
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put(EVENT_TYPE_FIELD, event.getClass().getName());
            envelope.set(EVENT_FIELD, objectMapper.valueToTree(event));
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException(msg("Failed to serialize event of type '{}'", event.getClass().getName()), e);
        }
    }

    @Override
    public Object deserializeFromString(String serializedEvent) {
        requireNonNull(serializedEvent, "No serializedEvent provided");
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(serializedEvent);
        } catch (JsonProcessingException e) {
            throw new EventDeserializationException("Failed to parse the serialized event", e);
        }
        var eventType = envelope.path(EVENT_TYPE_FIELD);
        var event     = envelope.get(EVENT_FIELD);
        if (!eventType.isTextual() || event == null) {
            throw new EventDeserializationException(msg("The serialized event is missing the '{}' or '{}' field", EVENT_TYPE_FIELD, EVENT_FIELD));
        }
        var eventJavaType = resolveEventType(eventType.asText());
        try {
            return objectMapper.treeToValue(event, eventJavaType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventDeserializationException(msg("Failed to deserialize event of type '{}'", eventJavaType.getName()), e);
        }
    }

    private Class<?> resolveEventType(String eventType) {
        requireNonBlank(eventType, "The serialized event has a blank event type");
        try {
            var classLoader = Thread.currentThread().getContextClassLoader();
            return Class.forName(eventType, true, classLoader != null ? classLoader : JacksonEventSerializer.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new EventDeserializationException(msg("Couldn't find the event type '{}'", eventType), e);
        }
    }
}
