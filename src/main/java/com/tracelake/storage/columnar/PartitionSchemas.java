package com.tracelake.storage.columnar;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.Manifest;
import org.apache.avro.Schema;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Declared Avro schemas of the partition files (schema_version 1) and of the offset index.
 *
 * Non-union field types are required columns; {@code ["null", T]} unions are optional.
 */
@Component
public class PartitionSchemas {

    private static final String SLOW_QUERY_SCHEMA = """
        {
          "type": "record",
          "name": "SlowQuery",
          "namespace": "com.tracelake.storage",
          "fields": [
            {"name": "record_key", "type": "string"},
            {"name": "timestamp", "type": "string"},
            {"name": "ts_epoch", "type": "long"},
            {"name": "duration_ms", "type": "long"},
            {"name": "docs_examined", "type": "long"},
            {"name": "docs_returned", "type": "long"},
            {"name": "keys_examined", "type": "long"},
            {"name": "query_hash", "type": "string"},
            {"name": "database", "type": "string"},
            {"name": "collection", "type": "string"},
            {"name": "namespace", "type": "string"},
            {"name": "plan_summary", "type": "string"},
            {"name": "query_text", "type": ["null", "string"], "default": null},
            {"name": "operation", "type": "string"},
            {"name": "connection_id", "type": ["null", "string"], "default": null},
            {"name": "username", "type": ["null", "string"], "default": null},
            {"name": "file_id", "type": "int"},
            {"name": "byte_offset", "type": "long"},
            {"name": "byte_length", "type": "int"},
            {"name": "line_number", "type": "long"}
          ]
        }
        """;

    private static final String AUTH_SCHEMA = """
        {
          "type": "record",
          "name": "Authentication",
          "namespace": "com.tracelake.storage",
          "fields": [
            {"name": "record_key", "type": "string"},
            {"name": "timestamp", "type": "string"},
            {"name": "ts_epoch", "type": "long"},
            {"name": "user", "type": ["null", "string"], "default": null},
            {"name": "database", "type": ["null", "string"], "default": null},
            {"name": "mechanism", "type": ["null", "string"], "default": null},
            {"name": "result", "type": "string"},
            {"name": "connection_id", "type": ["null", "string"], "default": null},
            {"name": "remote_address", "type": ["null", "string"], "default": null},
            {"name": "app_name", "type": ["null", "string"], "default": null},
            {"name": "error", "type": ["null", "string"], "default": null},
            {"name": "file_id", "type": "int"},
            {"name": "byte_offset", "type": "long"},
            {"name": "byte_length", "type": "int"},
            {"name": "line_number", "type": "long"}
          ]
        }
        """;

    private static final String CONNECTION_SCHEMA = """
        {
          "type": "record",
          "name": "Connection",
          "namespace": "com.tracelake.storage",
          "fields": [
            {"name": "record_key", "type": "string"},
            {"name": "timestamp", "type": "string"},
            {"name": "ts_epoch", "type": "long"},
            {"name": "event", "type": "string"},
            {"name": "connection_id", "type": ["null", "string"], "default": null},
            {"name": "remote_address", "type": ["null", "string"], "default": null},
            {"name": "connection_count", "type": ["null", "int"], "default": null},
            {"name": "app_name", "type": ["null", "string"], "default": null},
            {"name": "driver", "type": ["null", "string"], "default": null},
            {"name": "file_id", "type": "int"},
            {"name": "byte_offset", "type": "long"},
            {"name": "byte_length", "type": "int"},
            {"name": "line_number", "type": "long"}
          ]
        }
        """;

    private static final String OFFSET_INDEX_SCHEMA = """
        {
          "type": "record",
          "name": "OffsetIndexEntry",
          "namespace": "com.tracelake.storage",
          "fields": [
            {"name": "record_key", "type": "string"},
            {"name": "ts_epoch", "type": "long"},
            {"name": "file_id", "type": "int"},
            {"name": "byte_offset", "type": "long"},
            {"name": "byte_length", "type": "int"},
            {"name": "line_number", "type": "long"},
            {"name": "sample", "type": ["null", "string"], "default": null}
          ]
        }
        """;

    private final Map<EventKind, Schema> schemas;
    private final Schema offsetIndexSchema;

    public PartitionSchemas() {
        this.schemas = new EnumMap<>(EventKind.class);
        this.schemas.put(EventKind.SLOW_QUERY, parse(SLOW_QUERY_SCHEMA));
        this.schemas.put(EventKind.AUTH, parse(AUTH_SCHEMA));
        this.schemas.put(EventKind.CONNECTION, parse(CONNECTION_SCHEMA));
        this.offsetIndexSchema = parse(OFFSET_INDEX_SCHEMA);
    }

    private PartitionSchemas(Map<EventKind, Schema> schemas, Schema offsetIndexSchema) {
        this.schemas = schemas;
        this.offsetIndexSchema = offsetIndexSchema;
    }

    /**
     * Copy with the declared schema of one kind replaced
     */
    public PartitionSchemas withSchema(EventKind kind, Schema schema) {
        Map<EventKind, Schema> copy = new EnumMap<>(schemas);
        copy.put(kind, schema);
        return new PartitionSchemas(copy, offsetIndexSchema);
    }

    public Schema schemaFor(EventKind kind) {
        return schemas.get(kind);
    }

    public Schema offsetIndexSchema() {
        return offsetIndexSchema;
    }

    public int schemaVersion() {
        return Manifest.SCHEMA_VERSION;
    }

    /**
     * Non-null branch of an optional union, or the type itself
     */
    public static Schema valueType(Schema fieldSchema) {
        if (fieldSchema.getType() == Schema.Type.UNION) {
            for (Schema branch : fieldSchema.getTypes()) {
                if (branch.getType() != Schema.Type.NULL) {
                    return branch;
                }
            }
        }
        return fieldSchema;
    }

    public static boolean isRequired(Schema fieldSchema) {
        if (fieldSchema.getType() != Schema.Type.UNION) {
            return fieldSchema.getType() != Schema.Type.NULL;
        }
        for (Schema branch : fieldSchema.getTypes()) {
            if (branch.getType() == Schema.Type.NULL) {
                return false;
            }
        }
        return true;
    }

    private static Schema parse(String schemaJson) {
        return new Schema.Parser().parse(schemaJson);
    }
}
