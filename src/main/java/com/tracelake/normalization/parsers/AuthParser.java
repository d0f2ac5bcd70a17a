package com.tracelake.normalization.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracelake.domain.AuthEvent;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.normalization.RecordKeyGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for ACCESS component authentication entries
 */
@Component
public class AuthParser extends StructuredLogParser {

    static final Map<String, String> MESSAGE_RESULTS = new LinkedHashMap<>();

    static {
        MESSAGE_RESULTS.put("successfully authenticated", AuthEvent.RESULT_SUCCESS);
        MESSAGE_RESULTS.put("authentication succeeded", AuthEvent.RESULT_SUCCESS);
        MESSAGE_RESULTS.put("authentication failed", AuthEvent.RESULT_FAILURE);
    }

    private final RecordKeyGenerator keyGenerator;

    public AuthParser(RecordKeyGenerator keyGenerator) {
        this.keyGenerator = keyGenerator;
    }

    /**
     * Result implied by an ACCESS message, or null when the message is not an auth outcome
     */
    public static String matchResult(String message) {
        String lowered = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> needle : MESSAGE_RESULTS.entrySet()) {
            if (lowered.contains(needle.getKey())) {
                return needle.getValue();
            }
        }
        return null;
    }

    @Override
    public NormalizedEvent parse(JsonNode entry, ParseContext context) throws ParseException {
        String result = matchResult(message(entry));
        if (result == null) {
            return null;
        }
        JsonNode attr = attributes(entry);
        EventTime time = parseTime(entry);

        String user;
        String database = null;
        JsonNode rawUser = attr.path("user");
        if (rawUser.isObject()) {
            user = text(rawUser, "user", "userName", "username", "name");
            database = text(rawUser, "db", "dbName", "database");
        } else {
            user = text(attr, "user");
        }
        if (user == null) {
            user = text(attr, "principalName", "principal", "principal_user");
        }
        if (database == null) {
            database = text(attr, "db", "authenticationDatabase", "principalDb");
        }
        String mechanism = text(attr, "mechanism", "mechanismName");

        return AuthEvent.builder()
            .recordKey(keyGenerator.authKey(user, database, mechanism, result))
            .timestamp(time.getIso(), time.getEpochSeconds())
            .span(context.getSpan(), context.getLineNumber())
            .sample(context.getSample())
            .user(user)
            .database(database)
            .mechanism(mechanism)
            .result(result)
            .connectionId(connectionId(attr, entry))
            .remoteAddress(remoteAddress(attr))
            .appName(text(attr, "appName"))
            .error(text(attr, "error", "err"))
            .build();
    }

    @Override
    public EventKind getKind() {
        return EventKind.AUTH;
    }
}
