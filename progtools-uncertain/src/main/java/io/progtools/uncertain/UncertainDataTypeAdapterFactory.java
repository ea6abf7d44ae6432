package io.progtools.uncertain;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * GSON TypeAdapterFactory for polymorphic {@link UncertainData} serialization.
 *
 * <p>Every distribution is written as a JSON object whose first field is the
 * "type" discriminator taken from its {@link DistributionType} annotation,
 * followed by the variant's own fields:
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  ScalarData                             { "type": "scalar", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @DistributionType("scalar")     1. Read "type" field
 *  2. Serialize variant fields            2. Lookup registered class
 *  3. Put "type" field first              3. Deserialize with delegate
 * }</pre>
 *
 * <p>Unresolved components are stored as NaN, so both directions run the
 * delegate adapters in lenient mode.
 *
 * @see DistributionType
 * @see UncertainGsonConfig
 */
public final class UncertainDataTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends UncertainData>> typeToClass = new HashMap<>();
    private final Map<Class<? extends UncertainData>, String> classToType = new HashMap<>();

    private UncertainDataTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with the three distribution variants registered.
     *
     * @return a configured factory
     */
    public static UncertainDataTypeAdapterFactory create() {
        UncertainDataTypeAdapterFactory factory = new UncertainDataTypeAdapterFactory();
        factory.registerType(ScalarData.class);
        factory.registerType(UnweightedSamples.class);
        factory.registerType(MultivariateNormalDist.class);
        return factory;
    }

    /**
     * Registers an UncertainData implementation type.
     *
     * @param dataClass the class to register
     * @throws IllegalArgumentException if the class has no DistributionType annotation
     *         or if the type name is already registered
     */
    public void registerType(Class<? extends UncertainData> dataClass) {
        DistributionType annotation = dataClass.getAnnotation(DistributionType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + dataClass.getName() + " has no @DistributionType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, dataClass);
        classToType.put(dataClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!UncertainData.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    throw new IllegalArgumentException("Unregistered distribution type: " + value.getClass().getName());
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    UncertainDataTypeAdapterFactory.this, TypeToken.get(value.getClass()));

                StringWriter stringWriter = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(stringWriter);
                lenientWriter.setLenient(true);
                concreteDelegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonObject fields = JsonParser.parseString(stringWriter.toString()).getAsJsonObject();
                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in JSON: " + obj);
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends UncertainData> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException("Unknown distribution type: '" + typeName + "'. "
                        + "Known types: " + typeToClass.keySet());
                }
                if (!type.getRawType().isAssignableFrom(targetClass)) {
                    throw new JsonParseException("Distribution type '" + typeName + "' is not a "
                        + type.getRawType().getSimpleName());
                }

                TypeAdapter<? extends UncertainData> targetAdapter =
                    gson.getDelegateAdapter(UncertainDataTypeAdapterFactory.this, TypeToken.get(targetClass));
                JsonReader lenientReader = new JsonReader(new StringReader(obj.toString()));
                lenientReader.setLenient(true);
                return (T) targetAdapter.read(lenientReader);
            }
        };
    }

    /**
     * @param dataClass the distribution class
     * @return the type name, or null if not registered
     */
    public String getTypeName(Class<? extends UncertainData> dataClass) {
        return classToType.get(dataClass);
    }
}
