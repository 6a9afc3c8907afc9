package io.github.jsummarise.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import io.github.jsummarise.exception.UnknownTypeException;
import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;
import io.github.jsummarise.table.TableBuilder;
import io.github.jsummarise.table.Type;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;

/**
 * Tables from and to JSON arrays of records.
 */
public class JsonTables {
    private static final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    private JsonTables() {
    }

    public static Table read(String json, Map<String, Type> columnTypeMap) {
        return read(gson.fromJson(json, JsonArray.class), columnTypeMap);
    }

    public static Table read(InputStream inputStream, Map<String, Type> columnTypeMap) {
        try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            return read(gson.fromJson(reader, JsonArray.class), columnTypeMap);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Table read(JsonArray records, Map<String, Type> columnTypeMap) {
        TableBuilder tableBuilder = new TableBuilder(columnTypeMap);
        for (JsonElement record : records) {
            JsonObject jsonObject = record.getAsJsonObject();
            int i = 0;
            for (Map.Entry<String, Type> entry : columnTypeMap.entrySet()) {
                JsonElement jsonElement = jsonObject.get(entry.getKey());
                if (null == jsonElement || jsonElement.isJsonNull()) {
                    tableBuilder.append(i++, null);
                    continue;
                }
                switch (entry.getValue()) {
                    case DOUBLE:
                        tableBuilder.append(i, jsonElement.getAsDouble());
                        break;
                    case BIGINT:
                        tableBuilder.append(i, jsonElement.getAsLong());
                        break;
                    case INT:
                        tableBuilder.append(i, jsonElement.getAsInt());
                        break;
                    case BIGDECIMAL:
                        tableBuilder.append(i, jsonElement.getAsBigDecimal());
                        break;
                    case BOOLEAN:
                        tableBuilder.append(i, jsonElement.getAsBoolean());
                        break;
                    case STRING:
                        tableBuilder.append(i, jsonElement.getAsString());
                        break;
                    default:
                        throw new UnknownTypeException(format("cannot read column '%s' as %s", entry.getKey(), entry.getValue()));
                }
                i++;
            }
        }
        return tableBuilder.build();
    }

    /**
     * one object per row; named index levels first, then the columns keyed by their flattened label.
     * A label already taken is suffixed with _ and the column position.
     */
    public static String write(Table table) {
        Index index = table.getRowIndex();
        List<String> indexNames = index.names();
        List<String> keys = columnKeys(table.getHeader(), indexNames);
        JsonArray records = new JsonArray();
        for (int row = 0; row < table.size(); row++) {
            JsonObject jsonObject = new JsonObject();
            for (int level = 0; level < indexNames.size(); level++) {
                jsonObject.add(indexNames.get(level), toJson(index.key(row).get(level)));
            }
            for (int i = 0; i < table.columnCount(); i++) {
                Column column = table.getColumn(i);
                jsonObject.add(keys.get(i), toJson(column.get(row)));
            }
            records.add(jsonObject);
        }
        return gson.toJson(records);
    }

    private static List<String> columnKeys(Header header, List<String> indexNames) {
        Set<String> taken = new HashSet<>(indexNames);
        List<String> keys = new ArrayList<>(header.width());
        for (int i = 0; i < header.width(); i++) {
            String key = header.flatLabel(i);
            String unique = key;
            while (!taken.add(unique)) {
                unique = unique + "_" + i;
            }
            keys.add(unique);
        }
        return keys;
    }

    private static JsonElement toJson(Comparable comparable) {
        if (null == comparable) {
            return JsonNull.INSTANCE;
        }
        if (comparable instanceof Number) {
            return gson.toJsonTree(comparable);
        }
        if (comparable instanceof Boolean) {
            return gson.toJsonTree(comparable);
        }
        return gson.toJsonTree(comparable.toString());
    }
}
