package io.conveyor.spi.config;

import java.util.List;
import java.util.Map;
import java.util.Iterator;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.JavaType;
import io.conveyor.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * A mutable, JSON-backed set of parameters.
 *
 * System configuration loaded from a properties file keeps dotted keys flat, so
 * {@code database.type} is a single key and not a nested object.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new ConfigException("Expected object but got " + object);
        }
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    protected Config(Config config)
    {
        this.mapper = config.mapper;
        this.object = config.object.deepCopy();
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config setOptional(String key, Optional<?> v)
    {
        if (v.isPresent()) {
            set(key, v.get());
        }
        return this;
    }

    public Config setIfNotSet(String key, Object v)
    {
        if (!has(key) && v != null) {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(this);
    }

    public Config merge(Config other)
    {
        mergeJsonObject(object, other.deepCopy().object);
        return this;
    }

    private static void mergeJsonObject(ObjectNode src, ObjectNode other)
    {
        Iterator<Map.Entry<String, JsonNode>> ite = other.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            JsonNode s = src.get(pair.getKey());
            JsonNode v = pair.getValue();
            if (v.isObject() && s != null && s.isObject()) {
                mergeJsonObject((ObjectNode) s, (ObjectNode) v);
            }
            else {
                src.set(pair.getKey(), v);  // keeps order if key exists
            }
        }
    }

    private JsonNode writeObject(Object obj)
    {
        return mapper.valueToTree(obj);
    }

    public ConfigFactory getFactory()
    {
        return new ConfigFactory(mapper);
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return !object.fieldNames().hasNext();
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    @SuppressWarnings("unchecked")
    public <E> E convert(Class<E> type)
    {
        return (E) readObject(mapper.constructType(type), object, null);
    }

    @SuppressWarnings("unchecked")
    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return (E) readObject(mapper.constructType(type), value, key);
    }

    @SuppressWarnings("unchecked")
    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return (E) readObject(mapper.constructType(type), value, key);
    }

    @SuppressWarnings("unchecked")
    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of((E) readObject(mapper.constructType(type), value, key));
    }

    /**
     * Reads a list. A string value is split at commas, so that properties files
     * can write {@code key = a, b, c}.
     */
    @SuppressWarnings("unchecked")
    public <E> List<E> getListOrEmpty(String key, Class<E> elementType)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return ImmutableList.of();
        }
        if (value.isTextual()) {
            ImmutableList.Builder<E> builder = ImmutableList.builder();
            for (String element : Splitter.on(',').trimResults().omitEmptyStrings().split(value.textValue())) {
                builder.add((E) readObject(mapper.constructType(elementType), mapper.getNodeFactory().textNode(element), key));
            }
            return builder.build();
        }
        return (List<E>) readObject(mapper.getTypeFactory().constructCollectionType(List.class, elementType), value, key);
    }

    public Config getNested(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    public Config getNestedOrGetEmpty(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return new Config(mapper);
        }
        else if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    /**
     * Returns the parameters whose keys start with {@code prefix}, with the prefix removed.
     */
    public Config getPrefixed(String prefix)
    {
        Config config = new Config(mapper);
        Iterator<Map.Entry<String, JsonNode>> ite = object.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            if (pair.getKey().startsWith(prefix) && pair.getKey().length() > prefix.length()) {
                config.object.set(pair.getKey().substring(prefix.length()), pair.getValue().deepCopy());
            }
        }
        return config;
    }

    private Object readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            throw propagateConvertException(ex, typeNameOf(type), value, key);
        }
    }

    private ConfigException propagateConvertException(Exception ex, String typeName, JsonNode value, String key)
    {
        ThrowablesUtil.propagateIfInstanceOf(ex, ConfigException.class);
        String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                typeName, key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
        return new ConfigException(message, ex);
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(Integer.class) || raw.equals(int.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(Long.class) || raw.equals(long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(Boolean.class) || raw.equals(boolean.class)) {
            return "'true' or 'false'";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        else if (Map.class.isAssignableFrom(raw)) {
            return "object type";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        else {
            return json.substring(0, 97) + "...";
        }
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
