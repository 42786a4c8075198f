/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.streamledger.ledger.mongodb.nativedriver;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventSerializer} that uses Jackson to convert events to documents. The event is stored as
 * <pre>
 * { "type": "&lt;fully qualified class name&gt;", "data": { ... } }
 * </pre>
 * and the type is used to instantiate the event when it's read. Events must therefore be (de)serializable by the supplied
 * {@link ObjectMapper}.
 */
public class JacksonEventSerializer implements EventSerializer {
    static final String TYPE = "type";
    static final String DATA = "data";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonEventSerializer() {
        this(new ObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public Document serialize(Object event) {
        requireNonNull(event, "Event cannot be null");
        Map<String, Object> data = objectMapper.convertValue(event, MAP_TYPE);
        return new Document(TYPE, event.getClass().getName()).append(DATA, new Document(data));
    }

    @Override
    public Object deserialize(Document document) {
        requireNonNull(document, "Document cannot be null");
        String type = document.getString(TYPE);
        if (type == null) {
            throw new IllegalArgumentException("Event document doesn't contain a " + TYPE + ": " + document.toJson());
        }
        final Class<?> eventType;
        try {
            eventType = Class.forName(type);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Cannot find event type " + type, e);
        }
        return objectMapper.convertValue(document.get(DATA, Document.class), eventType);
    }
}
