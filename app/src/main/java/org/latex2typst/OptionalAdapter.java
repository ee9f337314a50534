package org.latex2typst;

import com.google.gson.*;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;

// Lets Gson write Optional record components (snippets, default values)
// as the wrapped value or null
public class OptionalAdapter implements JsonSerializer<Optional<?>> {
    @Override
    public JsonElement serialize(Optional<?> src, Type typeOfSrc, JsonSerializationContext context) {
        if (src.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        return context.serialize(src.get(), innerType(typeOfSrc));
    }

    // T of Optional<T>, Object when the type is raw
    private static Type innerType(Type optionalType) {
        if (optionalType instanceof ParameterizedType parameterized) {
            return parameterized.getActualTypeArguments()[0];
        }
        return Object.class;
    }
}
