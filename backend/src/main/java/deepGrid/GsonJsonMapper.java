package deepGrid;

import com.google.gson.Gson;
import io.javalin.json.JsonMapper;
import java.lang.reflect.Type;

/**
 * Lets Javalin read and write request bodies with Gson.
 */
public final class GsonJsonMapper implements JsonMapper {
    private final Gson gson;

    public GsonJsonMapper() {
        this(new Gson());
    }

    public GsonJsonMapper(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String toJsonString(Object obj, Type type) {
        return gson.toJson(obj, type);
    }

    @Override
    public <T> T fromJsonString(String json, Type targetType) {
        return gson.fromJson(json, targetType);
    }
}
