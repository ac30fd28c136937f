package io.dazzleduck.sharing.http.server;

import io.helidon.webserver.ServerRequest;

import java.util.function.Function;

public interface ParameterUtils {

    /**
     * Value of a query parameter, falling back to the request header of the same name.
     */
    static <T> T getParameterValue(String parameter, ServerRequest request, T defaultValue, Class<T> tClass) {
        Function<String, T> mapFunction;
        if (tClass.equals(Long.class)) {
            mapFunction = s -> tClass.cast(Long.valueOf(s));
        } else if (tClass.equals(Integer.class)) {
            mapFunction = s -> tClass.cast(Integer.valueOf(s));
        } else if (tClass.equals(String.class)) {
            mapFunction = tClass::cast;
        } else {
            throw new IllegalArgumentException("unsupported parameter type " + tClass);
        }
        var value = request.queryParams().first(parameter).or(() -> request.headers().first(parameter));
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return mapFunction.apply(value.get());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("invalid value for " + parameter + ": " + value.get());
        }
    }
}
