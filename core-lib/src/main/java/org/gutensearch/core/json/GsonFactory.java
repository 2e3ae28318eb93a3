package org.gutensearch.core.json;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/** Gson instances producing the snake_case JSON used by both HTTP APIs. */
public final class GsonFactory {
    private GsonFactory() {}

    public static Gson create() {
        return new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeNulls()
            .create();
    }
}
