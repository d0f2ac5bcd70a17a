package com.tracelake.storage.columnar;

import com.tracelake.domain.AuthEvent;
import com.tracelake.domain.ConnectionEvent;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.SlowQueryEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column values produced for each event kind
 */
public final class EventRows {

    private EventRows() {
    }

    public static Map<String, Object> toRow(NormalizedEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("record_key", event.getRecordKey());
        row.put("timestamp", event.getTimestamp());
        row.put("ts_epoch", event.getTsEpoch());

        switch (event.getKind()) {
            case SLOW_QUERY -> {
                SlowQueryEvent slow = (SlowQueryEvent) event;
                row.put("duration_ms", slow.getDurationMs());
                row.put("docs_examined", slow.getDocsExamined());
                row.put("docs_returned", slow.getDocsReturned());
                row.put("keys_examined", slow.getKeysExamined());
                row.put("query_hash", slow.getQueryHash());
                row.put("database", slow.getDatabase());
                row.put("collection", slow.getCollection());
                row.put("namespace", slow.getNamespace());
                row.put("plan_summary", slow.getPlanSummary());
                row.put("query_text", slow.getQueryText());
                row.put("operation", slow.getOperation());
                row.put("connection_id", slow.getConnectionId());
                row.put("username", slow.getUsername());
            }
            case AUTH -> {
                AuthEvent auth = (AuthEvent) event;
                row.put("user", auth.getUser());
                row.put("database", auth.getDatabase());
                row.put("mechanism", auth.getMechanism());
                row.put("result", auth.getResult());
                row.put("connection_id", auth.getConnectionId());
                row.put("remote_address", auth.getRemoteAddress());
                row.put("app_name", auth.getAppName());
                row.put("error", auth.getError());
            }
            case CONNECTION -> {
                ConnectionEvent connection = (ConnectionEvent) event;
                row.put("event", connection.getEvent());
                row.put("connection_id", connection.getConnectionId());
                row.put("remote_address", connection.getRemoteAddress());
                row.put("connection_count", connection.getConnectionCount());
                row.put("app_name", connection.getAppName());
                row.put("driver", connection.getDriver());
            }
        }

        row.put("file_id", event.getSpan().getFileId());
        row.put("byte_offset", event.getSpan().getByteOffset());
        row.put("byte_length", event.getSpan().getByteLength());
        row.put("line_number", event.getLineNumber());
        return row;
    }
}
